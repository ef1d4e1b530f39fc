/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config.constants;

import com.zabbixtools.baseline.common.config.ConfigDef;

import static com.zabbixtools.baseline.common.config.ConfigDef.Range.between;


/**
 * A class to keep output and zabbix_sender configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class OutputConfig {

  /**
   * <code>output.file</code>
   */
  public static final String OUTPUT_FILE_CONFIG = "output.file";
  public static final String DEFAULT_OUTPUT_FILE = "";
  public static final String OUTPUT_FILE_DOC = "The file the ingestion lines are written to. Empty means standard output.";

  /**
   * <code>output.append</code>
   */
  public static final String OUTPUT_APPEND_CONFIG = "output.append";
  public static final boolean DEFAULT_OUTPUT_APPEND = false;
  public static final String OUTPUT_APPEND_DOC = "Append to the output file instead of truncating it.";

  /**
   * <code>zabbix.sender.binary</code>
   */
  public static final String ZABBIX_SENDER_BINARY_CONFIG = "zabbix.sender.binary";
  public static final String DEFAULT_ZABBIX_SENDER_BINARY = "";
  public static final String ZABBIX_SENDER_BINARY_DOC = "The zabbix_sender executable launched on the output file "
      + "after the run. Empty disables the handoff, which also requires an output file.";

  /**
   * <code>zabbix.sender.server</code>
   */
  public static final String ZABBIX_SENDER_SERVER_CONFIG = "zabbix.sender.server";
  public static final String DEFAULT_ZABBIX_SENDER_SERVER = "127.0.0.1";
  public static final String ZABBIX_SENDER_SERVER_DOC = "The Zabbix server or proxy receiving the trapper values.";

  /**
   * <code>zabbix.sender.port</code>
   */
  public static final String ZABBIX_SENDER_PORT_CONFIG = "zabbix.sender.port";
  public static final int DEFAULT_ZABBIX_SENDER_PORT = 10051;
  public static final String ZABBIX_SENDER_PORT_DOC = "The trapper port of the Zabbix server or proxy.";

  private OutputConfig() {
  }

  /**
   * Define configs for the output.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the output.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(OUTPUT_FILE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_OUTPUT_FILE,
                            ConfigDef.Importance.MEDIUM,
                            OUTPUT_FILE_DOC)
                    .define(OUTPUT_APPEND_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_OUTPUT_APPEND,
                            ConfigDef.Importance.LOW,
                            OUTPUT_APPEND_DOC)
                    .define(ZABBIX_SENDER_BINARY_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_ZABBIX_SENDER_BINARY,
                            ConfigDef.Importance.LOW,
                            ZABBIX_SENDER_BINARY_DOC)
                    .define(ZABBIX_SENDER_SERVER_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_ZABBIX_SENDER_SERVER,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.LOW,
                            ZABBIX_SENDER_SERVER_DOC)
                    .define(ZABBIX_SENDER_PORT_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ZABBIX_SENDER_PORT,
                            between(1, 65535),
                            ConfigDef.Importance.LOW,
                            ZABBIX_SENDER_PORT_DOC);
  }
}
