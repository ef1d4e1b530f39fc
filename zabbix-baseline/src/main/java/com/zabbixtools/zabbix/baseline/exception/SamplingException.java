/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.zabbixtools.zabbix.baseline.exception;

import com.zabbixtools.baseline.exception.BaselineException;

/**
 * The samples of an item could not be fetched. Distinct from an empty window, which is not an error.
 */
public class SamplingException extends BaselineException {

  public SamplingException(String message, Throwable cause) {
    super(message, cause);
  }

  public SamplingException(String message) {
    super(message);
  }
}
