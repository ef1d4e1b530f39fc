/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config.constants;

import com.zabbixtools.baseline.common.config.ConfigDef;
import com.zabbixtools.zabbix.baseline.api.ZabbixApiClient;

import static com.zabbixtools.baseline.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep Zabbix API configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class ZabbixApiConfig {

  /**
   * <code>zabbix.api.url</code>
   */
  public static final String ZABBIX_API_URL_CONFIG = "zabbix.api.url";
  public static final String ZABBIX_API_URL_DOC = "The JSON-RPC endpoint of the Zabbix frontend, "
      + "e.g. http://zabbix.example.com/api_jsonrpc.php.";

  /**
   * <code>zabbix.api.username</code>
   */
  public static final String ZABBIX_API_USERNAME_CONFIG = "zabbix.api.username";
  public static final String ZABBIX_API_USERNAME_DOC = "The user to log in to the Zabbix API with.";

  /**
   * <code>zabbix.api.password</code>
   */
  public static final String ZABBIX_API_PASSWORD_CONFIG = "zabbix.api.password";
  public static final String DEFAULT_ZABBIX_API_PASSWORD = "";
  public static final String ZABBIX_API_PASSWORD_DOC = "The password of the API user. It is never logged.";

  /**
   * <code>zabbix.api.request.timeout.ms</code>
   */
  public static final String ZABBIX_API_REQUEST_TIMEOUT_MS_CONFIG = "zabbix.api.request.timeout.ms";
  public static final int DEFAULT_ZABBIX_API_REQUEST_TIMEOUT_MS = 30000;
  public static final String ZABBIX_API_REQUEST_TIMEOUT_MS_DOC = "The connect and socket timeout in milliseconds "
      + "of a single Zabbix API call.";

  /**
   * <code>zabbix.query.client.class</code>
   */
  public static final String ZABBIX_QUERY_CLIENT_CLASS_CONFIG = "zabbix.query.client.class";
  public static final Class<?> DEFAULT_ZABBIX_QUERY_CLIENT_CLASS = ZabbixApiClient.class;
  public static final String ZABBIX_QUERY_CLIENT_CLASS_DOC = "The class implementing "
      + "com.zabbixtools.zabbix.baseline.api.ZabbixQueryCapability used to discover entities and fetch history.";

  private ZabbixApiConfig() {
  }

  /**
   * Define configs for the Zabbix API client.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the Zabbix API client.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ZABBIX_API_URL_CONFIG,
                            ConfigDef.Type.STRING,
                            ConfigDef.NO_DEFAULT_VALUE,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            ZABBIX_API_URL_DOC)
                    .define(ZABBIX_API_USERNAME_CONFIG,
                            ConfigDef.Type.STRING,
                            ConfigDef.NO_DEFAULT_VALUE,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            ZABBIX_API_USERNAME_DOC)
                    .define(ZABBIX_API_PASSWORD_CONFIG,
                            ConfigDef.Type.PASSWORD,
                            DEFAULT_ZABBIX_API_PASSWORD,
                            ConfigDef.Importance.HIGH,
                            ZABBIX_API_PASSWORD_DOC)
                    .define(ZABBIX_API_REQUEST_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ZABBIX_API_REQUEST_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            ZABBIX_API_REQUEST_TIMEOUT_MS_DOC)
                    .define(ZABBIX_QUERY_CLIENT_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_ZABBIX_QUERY_CLIENT_CLASS,
                            ConfigDef.Importance.LOW,
                            ZABBIX_QUERY_CLIENT_CLASS_DOC);
  }
}
