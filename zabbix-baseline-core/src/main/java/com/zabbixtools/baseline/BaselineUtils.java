/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.baseline;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;

/**
 * Utils class shared by the baseline modules.
 */
public final class BaselineUtils {
  private static final DateTimeFormatter UTC_FORMATTER = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();

  private BaselineUtils() {

  }

  /**
   * @param epochSeconds Time in seconds since the epoch, as Zabbix reports clocks.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long epochSeconds) {
    return UTC_FORMATTER.format(Instant.ofEpochSecond(epochSeconds));
  }
}
