/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config.constants;

import com.zabbixtools.baseline.common.config.ConfigDef;

import static com.zabbixtools.baseline.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep comparator configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class ComparatorConfig {

  /**
   * <code>comparator.history.fetch.threads</code>
   */
  public static final String HISTORY_FETCH_THREADS_CONFIG = "comparator.history.fetch.threads";
  public static final int DEFAULT_HISTORY_FETCH_THREADS = 1;
  public static final String HISTORY_FETCH_THREADS_DOC = "The number of historical weeks of one item fetched "
      + "concurrently. The result does not depend on this value.";

  /**
   * <code>comparator.history.fetch.timeout.ms</code>
   */
  public static final String HISTORY_FETCH_TIMEOUT_MS_CONFIG = "comparator.history.fetch.timeout.ms";
  public static final long DEFAULT_HISTORY_FETCH_TIMEOUT_MS = 60000L;
  public static final String HISTORY_FETCH_TIMEOUT_MS_DOC = "The maximum time in milliseconds to wait for the "
      + "history of one week, counted from the start of its fetch. A week that times out is treated as missing.";

  /**
   * <code>run.timeout.ms</code>
   */
  public static final String RUN_TIMEOUT_MS_CONFIG = "run.timeout.ms";
  public static final long DEFAULT_RUN_TIMEOUT_MS = 0L;
  public static final String RUN_TIMEOUT_MS_DOC = "The deadline in milliseconds of the whole run. Items not started "
      + "before the deadline are skipped. 0 means no deadline.";

  private ComparatorConfig() {
  }

  /**
   * Define configs for the comparator.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the comparator.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(HISTORY_FETCH_THREADS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_HISTORY_FETCH_THREADS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            HISTORY_FETCH_THREADS_DOC)
                    .define(HISTORY_FETCH_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_HISTORY_FETCH_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            HISTORY_FETCH_TIMEOUT_MS_DOC)
                    .define(RUN_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_RUN_TIMEOUT_MS,
                            atLeast(0),
                            ConfigDef.Importance.LOW,
                            RUN_TIMEOUT_MS_DOC);
  }
}
