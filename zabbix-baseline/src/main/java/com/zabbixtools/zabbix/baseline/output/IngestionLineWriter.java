/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.output;

import com.zabbixtools.zabbix.baseline.detector.ComparisonResult;
import java.io.IOException;
import java.io.Writer;

import static com.zabbixtools.baseline.common.utils.Utils.validateNotNull;

/**
 * Writes one ingestion line per result to a sink owned by the caller. Whole lines are written under a lock so
 * concurrent writers never interleave partial lines. This class never closes the sink.
 */
public class IngestionLineWriter {
  private final Writer _sink;
  private long _linesWritten;

  public IngestionLineWriter(Writer sink) {
    _sink = validateNotNull(sink, "sink cannot be null.");
    _linesWritten = 0L;
  }

  /**
   * @param result A result with a deviation.
   */
  public synchronized void write(ComparisonResult result) throws IOException {
    if (!result.hasDeviation()) {
      throw new IllegalArgumentException("Cannot write a result without deviation: " + result);
    }
    _sink.write(IngestionLineFormatter.format(result));
    _linesWritten++;
  }

  public synchronized void flush() throws IOException {
    _sink.flush();
  }

  public synchronized long linesWritten() {
    return _linesWritten;
  }
}
