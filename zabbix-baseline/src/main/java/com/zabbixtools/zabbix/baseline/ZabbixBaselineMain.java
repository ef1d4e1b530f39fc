/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.zabbixtools.baseline.common.config.ConfigException;
import com.zabbixtools.baseline.exception.BaselineException;
import com.zabbixtools.zabbix.baseline.api.ZabbixQueryCapability;
import com.zabbixtools.zabbix.baseline.config.FilterConfigFileResolver;
import com.zabbixtools.zabbix.baseline.config.FilterConfiguration;
import com.zabbixtools.zabbix.baseline.config.ZabbixBaselineConfig;
import com.zabbixtools.zabbix.baseline.exception.DiscoveryException;
import com.zabbixtools.zabbix.baseline.exception.ZabbixApiException;
import com.zabbixtools.zabbix.baseline.output.IngestionLineWriter;
import com.zabbixtools.zabbix.baseline.output.ZabbixSenderCommand;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.commons.io.output.CloseShieldOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.zabbixtools.zabbix.baseline.ZabbixBaselineUtils.readConfig;
import static com.zabbixtools.zabbix.baseline.config.constants.OutputConfig.OUTPUT_APPEND_CONFIG;
import static com.zabbixtools.zabbix.baseline.config.constants.OutputConfig.OUTPUT_FILE_CONFIG;
import static com.zabbixtools.zabbix.baseline.config.constants.OutputConfig.ZABBIX_SENDER_BINARY_CONFIG;
import static com.zabbixtools.zabbix.baseline.config.constants.OutputConfig.ZABBIX_SENDER_PORT_CONFIG;
import static com.zabbixtools.zabbix.baseline.config.constants.OutputConfig.ZABBIX_SENDER_SERVER_CONFIG;
import static com.zabbixtools.zabbix.baseline.config.constants.ZabbixApiConfig.ZABBIX_QUERY_CLIENT_CLASS_CONFIG;

/**
 * The main class to run the Zabbix baseline tool once.
 *
 * Exit status: 0 when the run completed, even if items were skipped; 2 on a configuration or operator error; 3 if the
 * Zabbix API session could not be opened; 4 if the output could not be written; 5 if the zabbix_sender handoff failed.
 */
public final class ZabbixBaselineMain {
  private static final Logger LOG = LoggerFactory.getLogger(ZabbixBaselineMain.class);
  static final int EXIT_OK = 0;
  static final int EXIT_CONFIG_ERROR = 2;
  static final int EXIT_API_ERROR = 3;
  static final int EXIT_OUTPUT_ERROR = 4;
  static final int EXIT_SENDER_ERROR = 5;
  static final String METRICS_LOGGER = "com.zabbixtools.zabbix.baseline.metrics";

  private ZabbixBaselineMain() { }

  /**
   * The main function to run the tool.
   * @param args The properties file, optionally followed by the output file.
   */
  public static void main(String[] args) {
    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on thread {}", t, e));
    System.exit(run(args, Clock.systemUTC()));
  }

  static int run(String[] args, Clock clock) {
    if (args.length == 0 || args.length > 2) {
      String usage = String.format("USAGE: java %s zabbixbaseline.properties [output file]",
                                   ZabbixBaselineMain.class.getSimpleName());
      System.err.println(usage);
      LOG.error(usage);
      return EXIT_CONFIG_ERROR;
    }

    ZabbixBaselineConfig config;
    FilterConfiguration filters;
    ZabbixQueryCapability client;
    try {
      Map<String, String> overrides = args.length > 1 ? Collections.singletonMap(OUTPUT_FILE_CONFIG, args[1])
                                                      : Collections.emptyMap();
      config = readConfig(args[0], overrides);
      FilterConfigFileResolver filterResolver = new FilterConfigFileResolver();
      filterResolver.configure(config.mergedConfigValues());
      filters = filterResolver.filterConfiguration();
      client = config.getConfiguredInstance(ZABBIX_QUERY_CLIENT_CLASS_CONFIG, ZabbixQueryCapability.class);
    } catch (IOException e) {
      LOG.error("Unable to read the properties file {}.", args[0], e);
      return EXIT_CONFIG_ERROR;
    } catch (ConfigException | BaselineException e) {
      LOG.error("Invalid configuration: {}", e.getMessage(), e);
      return EXIT_CONFIG_ERROR;
    }

    MetricRegistry metricRegistry = new MetricRegistry();
    Slf4jReporter reporter = Slf4jReporter.forRegistry(metricRegistry)
                                          .outputTo(LoggerFactory.getLogger(METRICS_LOGGER))
                                          .convertRatesTo(TimeUnit.SECONDS)
                                          .convertDurationsTo(TimeUnit.MILLISECONDS)
                                          .build();
    String outputFile = config.getString(OUTPUT_FILE_CONFIG);
    int status = runWithClient(config, client, filters, outputFile, clock, metricRegistry);
    reporter.report();

    String senderBinary = config.getString(ZABBIX_SENDER_BINARY_CONFIG);
    if (status == EXIT_OK && !senderBinary.isEmpty()) {
      status = handOffToSender(new ZabbixSenderCommand(senderBinary, config.getString(ZABBIX_SENDER_SERVER_CONFIG),
                                                       config.getInt(ZABBIX_SENDER_PORT_CONFIG), outputFile));
    }
    config.logUnused();
    return status;
  }

  private static int runWithClient(ZabbixBaselineConfig config,
                                   ZabbixQueryCapability client,
                                   FilterConfiguration filters,
                                   String outputFile,
                                   Clock clock,
                                   MetricRegistry metricRegistry) {
    int status;
    try {
      client.open();
    } catch (ZabbixApiException e) {
      LOG.error("Unable to open the Zabbix API session: {}", e.getMessage(), e);
      closeClient(client);
      return EXIT_API_ERROR;
    }

    ZabbixBaselineRunner runner = new ZabbixBaselineRunner(config, client, filters, clock, metricRegistry);
    try (Writer sink = openSink(outputFile, config.getBoolean(OUTPUT_APPEND_CONFIG))) {
      runner.run(new IngestionLineWriter(sink));
      status = EXIT_OK;
    } catch (DiscoveryException e) {
      LOG.error(e.getMessage());
      status = EXIT_CONFIG_ERROR;
    } catch (IOException e) {
      LOG.error("Unable to write the output to {}.", outputFile.isEmpty() ? "standard output" : outputFile, e);
      status = EXIT_OUTPUT_ERROR;
    } finally {
      closeClient(client);
    }
    return status;
  }

  /**
   * Standard output is shielded so that closing the sink leaves it open.
   */
  private static Writer openSink(String outputFile, boolean append) throws IOException {
    if (outputFile.isEmpty()) {
      return new BufferedWriter(new OutputStreamWriter(CloseShieldOutputStream.wrap(System.out), StandardCharsets.UTF_8));
    }
    return Files.newBufferedWriter(Paths.get(outputFile), StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                                   StandardOpenOption.WRITE,
                                   append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING);
  }

  private static void closeClient(ZabbixQueryCapability client) {
    try {
      client.close();
    } catch (IOException e) {
      LOG.warn("Failed to close the Zabbix query client.", e);
    }
  }

  private static int handOffToSender(ZabbixSenderCommand sender) {
    try {
      return sender.run() == 0 ? EXIT_OK : EXIT_SENDER_ERROR;
    } catch (IOException e) {
      LOG.error("Unable to run {}.", sender.command(), e);
      return EXIT_SENDER_ERROR;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.error("Interrupted while waiting for {}.", sender.command(), e);
      return EXIT_SENDER_ERROR;
    }
  }
}
