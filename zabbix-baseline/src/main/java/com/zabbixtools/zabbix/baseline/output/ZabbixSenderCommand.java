/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.output;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches {@code zabbix_sender} on a file of ingestion lines:
 * {@code <binary> -z <server> -p <port> -T -i <file>}.
 */
public class ZabbixSenderCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ZabbixSenderCommand.class);
  private final List<String> _command;

  public ZabbixSenderCommand(String binary, String server, int port, String inputFile) {
    _command = Collections.unmodifiableList(Arrays.asList(binary, "-z", server, "-p", String.valueOf(port), "-T",
                                                          "-i", inputFile));
  }

  public List<String> command() {
    return _command;
  }

  /**
   * Run the command to completion, logging its output.
   *
   * @return The exit status of zabbix_sender, 0 if every value was accepted.
   * @throws IOException If the process could not be started or its output could not be read.
   */
  public int run() throws IOException, InterruptedException {
    LOG.info("Running {}.", String.join(" ", _command));
    Process process = new ProcessBuilder(_command).redirectErrorStream(true).start();
    String output = readOutput(process.getInputStream());
    int exitStatus = process.waitFor();
    if (exitStatus == 0) {
      LOG.info("zabbix_sender completed: {}", output.trim());
    } else {
      LOG.error("zabbix_sender exited with status {}: {}", exitStatus, output.trim());
    }
    return exitStatus;
  }

  /**
   * zabbix_sender prints host names and keys as given in the input file, which is written in UTF-8.
   */
  static String readOutput(InputStream stdout) throws IOException {
    try (InputStream in = stdout) {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    }
  }
}
