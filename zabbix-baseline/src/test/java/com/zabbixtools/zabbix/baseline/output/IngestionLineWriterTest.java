/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.output;

import com.zabbixtools.zabbix.baseline.detector.ComparisonResult;
import java.io.StringWriter;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class IngestionLineWriterTest {

  @Test
  public void testWritesOneLinePerResult() throws Exception {
    StringWriter sink = new StringWriter();
    IngestionLineWriter writer = new IngestionLineWriter(sink);

    writer.write(new ComparisonResult("web1", "system.cpu.load", ".wow", 1700000000L, 1.5, 3));
    writer.write(new ComparisonResult("web2", "system.cpu.load", ".wow", 1700000010L, -2.0, 1));
    writer.flush();

    assertEquals("\"web1\" system.cpu.load.wow 1700000000 1.500000\n"
                 + "\"web2\" system.cpu.load.wow 1700000010 -2.000000\n", sink.toString());
    assertEquals(2L, writer.linesWritten());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testResultWithoutDeviationIsRejected() throws Exception {
    new IngestionLineWriter(new StringWriter()).write(
        new ComparisonResult("web1", "system.cpu.load", ".wow", 1700000000L, Double.NaN, 0));
  }
}
