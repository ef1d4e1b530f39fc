/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

import com.zabbixtools.baseline.common.config.AbstractConfig;
import com.zabbixtools.baseline.common.config.ConfigDef;
import com.zabbixtools.baseline.common.config.ConfigException;
import com.zabbixtools.baseline.exception.BaselineException;
import com.zabbixtools.zabbix.baseline.config.constants.ComparatorConfig;
import com.zabbixtools.zabbix.baseline.config.constants.DiscoveryConfig;
import com.zabbixtools.zabbix.baseline.config.constants.OutputConfig;
import com.zabbixtools.zabbix.baseline.config.constants.ZabbixApiConfig;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.Map;

/**
 * The configuration class of the Zabbix baseline tool.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.zabbixtools.zabbix.baseline.config.constants}.
 */
public class ZabbixBaselineConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = OutputConfig.define(ComparatorConfig.define(DiscoveryConfig.define(ZabbixApiConfig.define(new ConfigDef()))));
  }

  public ZabbixBaselineConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public ZabbixBaselineConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckApiUrl();
    sanityCheckSenderHandoff();
  }

  /**
   * @return Merged config values.
   */
  public Map<String, Object> mergedConfigValues() {
    Map<String, Object> conf = originals();

    // Use parsed non-null value to overwrite originals.
    // This will keep default values and also keep values that are not defined under ConfigDef.
    values().forEach((k, v) -> {
      if (v != null) {
        conf.put(k, v);
      }
    });
    return conf;
  }

  @Override
  public <T> T getConfiguredInstance(String key, Class<T> t) throws BaselineException {
    return getConfiguredInstance(key, t, Collections.emptyMap());
  }

  @Override
  public <T> T getConfiguredInstance(String key, Class<T> t, Map<String, Object> configOverrides)
      throws BaselineException {
    Map<String, Object> configPairs = mergedConfigValues();
    configPairs.putAll(configOverrides);
    return super.getConfiguredInstance(key, t, configPairs);
  }

  /**
   * @return The configuration definition of the tool.
   */
  public static ConfigDef definition() {
    return CONFIG;
  }

  private void sanityCheckApiUrl() {
    String url = getString(ZabbixApiConfig.ZABBIX_API_URL_CONFIG);
    try {
      URI uri = new URI(url);
      if (uri.getScheme() == null || uri.getHost() == null
          || !("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))) {
        throw new ConfigException(ZabbixApiConfig.ZABBIX_API_URL_CONFIG, url, "Expected an http(s) URL with a host.");
      }
    } catch (URISyntaxException e) {
      throw new ConfigException(ZabbixApiConfig.ZABBIX_API_URL_CONFIG, url, e.getMessage());
    }
  }

  /**
   * zabbix_sender reads its input from a file, so the handoff needs an output file.
   */
  private void sanityCheckSenderHandoff() {
    String binary = getString(OutputConfig.ZABBIX_SENDER_BINARY_CONFIG);
    String outputFile = getString(OutputConfig.OUTPUT_FILE_CONFIG);
    if (!binary.isEmpty() && outputFile.isEmpty()) {
      throw new ConfigException(String.format("%s requires %s to be set.", OutputConfig.ZABBIX_SENDER_BINARY_CONFIG,
                                              OutputConfig.OUTPUT_FILE_CONFIG));
    }
  }
}
