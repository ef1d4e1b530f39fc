/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.zabbixtools.zabbix.baseline.exception;

import com.zabbixtools.baseline.exception.BaselineException;

/**
 * A Zabbix API call could not be completed: transport failure, non-success HTTP status, malformed body or a
 * JSON-RPC error member. When the server returned an error member its code and data are kept.
 */
public class ZabbixApiException extends BaselineException {
  public static final int NO_ERROR_CODE = 0;
  private final int _code;
  private final String _data;

  public ZabbixApiException(String message, int code, String data) {
    super(message);
    _code = code;
    _data = data;
  }

  public ZabbixApiException(String message, Throwable cause) {
    super(message, cause);
    _code = NO_ERROR_CODE;
    _data = null;
  }

  public ZabbixApiException(String message) {
    this(message, NO_ERROR_CODE, null);
  }

  /**
   * @return The JSON-RPC error code, or {@link #NO_ERROR_CODE} if the failure did not come from an error member.
   */
  public int code() {
    return _code;
  }

  /**
   * @return The JSON-RPC error data, {@code null} if none.
   */
  public String data() {
    return _data;
  }
}
