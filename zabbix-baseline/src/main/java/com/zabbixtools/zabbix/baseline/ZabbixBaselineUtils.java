/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline;

import com.zabbixtools.baseline.common.config.ConfigException;
import com.zabbixtools.zabbix.baseline.config.ZabbixBaselineConfig;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;


/**
 * Util class for convenience.
 */
public final class ZabbixBaselineUtils {
  public static final String DISCOVERY_SENSOR = "Discovery";
  public static final String COMPARATOR_SENSOR = "Comparator";
  public static final long SECONDS_PER_WEEK = 7L * 24 * 3600;

  private ZabbixBaselineUtils() {

  }

  /**
   * Get a configuration and throw exception if the configuration was not provided.
   * @param configs the config map.
   * @param configName the config to get.
   * @return The configuration string.
   */
  public static String getRequiredConfig(Map<String, ?> configs, String configName) {
    Object value = configs.get(configName);
    if (value == null || value.toString().isEmpty()) {
      throw new ConfigException(String.format("Configuration %s must be provided.", configName));
    }
    return value.toString();
  }

  /**
   * Read the properties file and apply the given overrides on top of it.
   *
   * @param propertiesFile The properties file.
   * @param overrides Entries replacing the ones of the file, e.g. from the command line.
   * @return The parsed configuration.
   */
  public static ZabbixBaselineConfig readConfig(String propertiesFile, Map<String, String> overrides) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = new FileInputStream(propertiesFile)) {
      props.load(propStream);
    }
    props.putAll(overrides);
    return new ZabbixBaselineConfig(props);
  }

  /**
   * Compare a Zabbix version string such as {@code 6.4.2} or {@code 7.0.0rc1} with the given release.
   *
   * @param version The version reported by {@code apiinfo.version}.
   * @param major Major release to compare against.
   * @param minor Minor release to compare against.
   * @return {@code true} if the version is the given release or a later one.
   */
  public static boolean isVersionAtLeast(String version, int major, int minor) {
    String[] parts = version.trim().split("\\.");
    int versionMajor = leadingNumber(parts[0]);
    int versionMinor = parts.length > 1 ? leadingNumber(parts[1]) : 0;
    return versionMajor > major || (versionMajor == major && versionMinor >= minor);
  }

  private static int leadingNumber(String part) {
    int end = 0;
    while (end < part.length() && Character.isDigit(part.charAt(end))) {
      end++;
    }
    if (end == 0) {
      throw new IllegalArgumentException("Unexpected version component: " + part);
    }
    return Integer.parseInt(part.substring(0, end));
  }
}
