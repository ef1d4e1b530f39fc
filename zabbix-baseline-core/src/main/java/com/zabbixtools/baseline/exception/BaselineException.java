/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.baseline.exception;

/**
 * Base checked exception of the baseline tooling.
 */
public class BaselineException extends Exception {

  public BaselineException(String message, Throwable cause) {
    super(message, cause);
  }

  public BaselineException(String message) {
    super(message);
  }

  public BaselineException(Throwable cause) {
    super(cause);
  }
}
