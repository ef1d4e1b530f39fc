/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

import com.zabbixtools.baseline.common.config.ConfigException;
import com.zabbixtools.baseline.common.config.types.Password;
import com.zabbixtools.zabbix.baseline.api.ZabbixApiClient;
import com.zabbixtools.zabbix.baseline.config.constants.ComparatorConfig;
import com.zabbixtools.zabbix.baseline.config.constants.DiscoveryConfig;
import com.zabbixtools.zabbix.baseline.config.constants.OutputConfig;
import com.zabbixtools.zabbix.baseline.config.constants.ZabbixApiConfig;
import java.util.Map;
import java.util.Properties;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ZabbixBaselineConfigTest {

  private static Properties requiredProperties() {
    Properties props = new Properties();
    props.setProperty(ZabbixApiConfig.ZABBIX_API_URL_CONFIG, "https://zabbix.example.com/api_jsonrpc.php");
    props.setProperty(ZabbixApiConfig.ZABBIX_API_USERNAME_CONFIG, "Admin");
    props.setProperty(DiscoveryConfig.FILTER_CONFIG_FILE_CONFIG, "config/filters.json");
    return props;
  }

  @Test
  public void testDefaults() {
    ZabbixBaselineConfig config = new ZabbixBaselineConfig(requiredProperties(), false);

    assertEquals("", config.getPassword(ZabbixApiConfig.ZABBIX_API_PASSWORD_CONFIG).value());
    assertEquals(ZabbixApiClient.class, config.getClass(ZabbixApiConfig.ZABBIX_QUERY_CLIENT_CLASS_CONFIG));
    assertEquals(ComparatorConfig.DEFAULT_HISTORY_FETCH_THREADS,
                 config.getInt(ComparatorConfig.HISTORY_FETCH_THREADS_CONFIG).intValue());
    assertEquals(0L, config.getLong(ComparatorConfig.RUN_TIMEOUT_MS_CONFIG).longValue());
    assertFalse(config.getBoolean(DiscoveryConfig.INCLUDE_ALL_HOSTS_CONFIG));
    assertEquals("", config.getString(OutputConfig.OUTPUT_FILE_CONFIG));
    assertFalse(config.getBoolean(OutputConfig.OUTPUT_APPEND_CONFIG));
    assertEquals(10051, config.getInt(OutputConfig.ZABBIX_SENDER_PORT_CONFIG).intValue());
  }

  @Test
  public void testMergedConfigValuesKeepParsedAndUndefinedValues() {
    Properties props = requiredProperties();
    props.setProperty(ZabbixApiConfig.ZABBIX_API_PASSWORD_CONFIG, "zabbix");
    props.setProperty(ComparatorConfig.HISTORY_FETCH_THREADS_CONFIG, "4");
    props.setProperty("custom.client.setting", "on");

    Map<String, Object> merged = new ZabbixBaselineConfig(props, false).mergedConfigValues();

    assertEquals(4, merged.get(ComparatorConfig.HISTORY_FETCH_THREADS_CONFIG));
    assertTrue(merged.get(ZabbixApiConfig.ZABBIX_API_PASSWORD_CONFIG) instanceof Password);
    assertEquals("on", merged.get("custom.client.setting"));
    assertEquals(DiscoveryConfig.DEFAULT_INCLUDE_ALL_HOSTS, merged.get(DiscoveryConfig.INCLUDE_ALL_HOSTS_CONFIG));
  }

  @Test(expected = ConfigException.class)
  public void testMissingApiUrl() {
    Properties props = requiredProperties();
    props.remove(ZabbixApiConfig.ZABBIX_API_URL_CONFIG);
    new ZabbixBaselineConfig(props, false);
  }

  @Test(expected = ConfigException.class)
  public void testApiUrlMustBeHttp() {
    Properties props = requiredProperties();
    props.setProperty(ZabbixApiConfig.ZABBIX_API_URL_CONFIG, "ftp://zabbix.example.com/api_jsonrpc.php");
    new ZabbixBaselineConfig(props, false);
  }

  @Test(expected = ConfigException.class)
  public void testNonPositiveFetchThreads() {
    Properties props = requiredProperties();
    props.setProperty(ComparatorConfig.HISTORY_FETCH_THREADS_CONFIG, "0");
    new ZabbixBaselineConfig(props, false);
  }

  @Test(expected = ConfigException.class)
  public void testSenderHandoffRequiresOutputFile() {
    Properties props = requiredProperties();
    props.setProperty(OutputConfig.ZABBIX_SENDER_BINARY_CONFIG, "/usr/bin/zabbix_sender");
    new ZabbixBaselineConfig(props, false);
  }

  @Test
  public void testSenderHandoff() {
    Properties props = requiredProperties();
    props.setProperty(OutputConfig.ZABBIX_SENDER_BINARY_CONFIG, "/usr/bin/zabbix_sender");
    props.setProperty(OutputConfig.OUTPUT_FILE_CONFIG, "/var/tmp/baseline.txt");
    props.setProperty(OutputConfig.ZABBIX_SENDER_SERVER_CONFIG, "zabbix.example.com");

    ZabbixBaselineConfig config = new ZabbixBaselineConfig(props, false);
    assertEquals("zabbix.example.com", config.getString(OutputConfig.ZABBIX_SENDER_SERVER_CONFIG));
  }
}
