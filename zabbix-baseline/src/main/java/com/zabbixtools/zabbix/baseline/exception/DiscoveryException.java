/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.zabbixtools.zabbix.baseline.exception;

import com.zabbixtools.baseline.exception.BaselineException;

/**
 * Thrown when discovery cannot proceed due to an operator error, e.g. no host was resolved and scanning all hosts
 * was not enabled.
 */
public class DiscoveryException extends BaselineException {

  public DiscoveryException(String message) {
    super(message);
  }
}
