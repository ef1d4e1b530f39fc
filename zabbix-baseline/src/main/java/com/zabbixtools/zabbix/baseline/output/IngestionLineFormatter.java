/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.output;

import com.zabbixtools.zabbix.baseline.detector.ComparisonResult;
import java.util.Locale;

/**
 * Renders results in the input format of {@code zabbix_sender -T}:
 * <pre>
 * "&lt;host&gt;" &lt;key&gt;&lt;postfix&gt; &lt;epoch seconds&gt; &lt;value&gt;
 * </pre>
 * The host is quoted verbatim, embedded quotes are not escaped. The value has six decimals.
 */
public final class IngestionLineFormatter {
  private static final String LINE_FORMAT = "\"%s\" %s%s %d %f\n";

  private IngestionLineFormatter() {

  }

  /**
   * @return The newline terminated line.
   */
  public static String format(String hostName, String itemKey, String postfix, long timestamp, double deviation) {
    return String.format(Locale.ROOT, LINE_FORMAT, hostName, itemKey, postfix == null ? "" : postfix, timestamp, deviation);
  }

  public static String format(ComparisonResult result) {
    return format(result.hostName(), result.itemKey(), result.postfix(), result.timestamp(), result.deviation());
  }
}
