/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config.constants;

import com.zabbixtools.baseline.common.config.ConfigDef;


/**
 * A class to keep discovery configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class DiscoveryConfig {

  /**
   * <code>filter.config.file</code>
   */
  public static final String FILTER_CONFIG_FILE_CONFIG = "filter.config.file";
  public static final String FILTER_CONFIG_FILE_DOC = "The JSON file listing the template, host and item filters. "
      + "Each item filter also carries the comparison algorithm and the postfix appended to the item key.";

  /**
   * <code>include.all.hosts</code>
   */
  public static final String INCLUDE_ALL_HOSTS_CONFIG = "include.all.hosts";
  public static final boolean DEFAULT_INCLUDE_ALL_HOSTS = false;
  public static final String INCLUDE_ALL_HOSTS_DOC = "If no host was resolved, query the item filters against all "
      + "hosts instead of stopping. This may be expensive on large installations.";

  private DiscoveryConfig() {
  }

  /**
   * Define configs for discovery.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for discovery.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(FILTER_CONFIG_FILE_CONFIG,
                            ConfigDef.Type.STRING,
                            ConfigDef.NO_DEFAULT_VALUE,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            FILTER_CONFIG_FILE_DOC)
                    .define(INCLUDE_ALL_HOSTS_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_INCLUDE_ALL_HOSTS,
                            ConfigDef.Importance.MEDIUM,
                            INCLUDE_ALL_HOSTS_DOC);
  }
}
