/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

/**
 * Comparison algorithms an item filter can select.
 */
public enum AlgorithmType {
  /**
   * Current sample minus the mean of the samples at the same time of day in previous weeks.
   */
  WEEK_OVER_WEEK
}
