/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.detector;

import java.util.Objects;

/**
 * The deviation of one item from its baseline, at the time of its current sample. The deviation is NaN when there
 * was no usable current sample, or no historical sample to compare against.
 */
public final class ComparisonResult {
  private final String _hostName;
  private final String _itemKey;
  private final String _postfix;
  private final long _timestamp;
  private final double _deviation;
  private final int _historicalSampleCount;

  public ComparisonResult(String hostName, String itemKey, String postfix, long timestamp, double deviation,
                          int historicalSampleCount) {
    _hostName = hostName;
    _itemKey = itemKey;
    _postfix = postfix;
    _timestamp = timestamp;
    _deviation = deviation;
    _historicalSampleCount = historicalSampleCount;
  }

  public String hostName() {
    return _hostName;
  }

  public String itemKey() {
    return _itemKey;
  }

  public String postfix() {
    return _postfix;
  }

  /**
   * @return Seconds since the epoch of the current sample, or of the comparison when there was none.
   */
  public long timestamp() {
    return _timestamp;
  }

  public double deviation() {
    return _deviation;
  }

  /**
   * @return Number of previous weeks that contributed to the baseline.
   */
  public int historicalSampleCount() {
    return _historicalSampleCount;
  }

  /**
   * @return {@code true} if the deviation is a number and the result can be emitted.
   */
  public boolean hasDeviation() {
    return !Double.isNaN(_deviation);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ComparisonResult that = (ComparisonResult) o;
    return _timestamp == that._timestamp && Double.compare(that._deviation, _deviation) == 0
           && _historicalSampleCount == that._historicalSampleCount && Objects.equals(_hostName, that._hostName)
           && Objects.equals(_itemKey, that._itemKey) && Objects.equals(_postfix, that._postfix);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_hostName, _itemKey, _postfix, _timestamp, _deviation, _historicalSampleCount);
  }

  @Override
  public String toString() {
    return String.format("%s %s%s @%d: %f (%d weeks)", _hostName, _itemKey, _postfix, _timestamp, _deviation,
                         _historicalSampleCount);
  }
}
