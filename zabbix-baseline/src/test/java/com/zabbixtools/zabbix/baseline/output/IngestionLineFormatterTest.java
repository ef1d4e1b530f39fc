/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.output;

import com.zabbixtools.zabbix.baseline.detector.ComparisonResult;
import java.util.Locale;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class IngestionLineFormatterTest {

  @Test
  public void testLineLayout() {
    assertEquals("\"web1\" cpu.load.avg 1700000000 3.250000\n",
                 IngestionLineFormatter.format("web1", "cpu.load", ".avg", 1700000000L, 3.25));
  }

  @Test
  public void testNegativeDeviationAndEmptyPostfix() {
    assertEquals("\"db 1\" net.if.in[eth0] 1700000060 -0.000001\n",
                 IngestionLineFormatter.format("db 1", "net.if.in[eth0]", "", 1700000060L, -0.000001));
    assertEquals("\"db 1\" net.if.in[eth0] 1700000060 12.000000\n",
                 IngestionLineFormatter.format("db 1", "net.if.in[eth0]", null, 1700000060L, 12));
  }

  @Test
  public void testDecimalSeparatorIgnoresDefaultLocale() {
    Locale defaultLocale = Locale.getDefault();
    Locale.setDefault(Locale.GERMANY);
    try {
      assertEquals("\"web1\" cpu.load.wow 1700000000 0.500000\n",
                   IngestionLineFormatter.format(new ComparisonResult("web1", "cpu.load", ".wow", 1700000000L, 0.5, 3)));
    } finally {
      Locale.setDefault(defaultLocale);
    }
  }
}
