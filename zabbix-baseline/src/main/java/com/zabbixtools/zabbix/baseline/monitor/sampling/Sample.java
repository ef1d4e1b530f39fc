/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.monitor.sampling;

import java.util.Objects;

/**
 * One observation of an item. Immutable.
 */
public final class Sample {
  private final String _itemId;
  private final String _value;
  private final long _clock;
  private final long _ns;

  /**
   * @param itemId Item the sample belongs to.
   * @param value The value as reported by Zabbix.
   * @param clock Time of the sample in seconds since the epoch.
   * @param ns Nanoseconds part of the sample time.
   */
  public Sample(String itemId, String value, long clock, long ns) {
    _itemId = itemId;
    _value = value;
    _clock = clock;
    _ns = ns;
  }

  public String itemId() {
    return _itemId;
  }

  public String value() {
    return _value;
  }

  public long clock() {
    return _clock;
  }

  public long ns() {
    return _ns;
  }

  /**
   * @return The value as a finite number, or {@code null} if it is not one.
   */
  public Double numericValue() {
    if (_value == null) {
      return null;
    }
    try {
      double parsed = Double.parseDouble(_value.trim());
      return Double.isFinite(parsed) ? parsed : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Sample sample = (Sample) o;
    return _clock == sample._clock && _ns == sample._ns && Objects.equals(_itemId, sample._itemId)
           && Objects.equals(_value, sample._value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_itemId, _value, _clock, _ns);
  }

  @Override
  public String toString() {
    return String.format("Sample{item=%s, value=%s, clock=%d, ns=%d}", _itemId, _value, _clock, _ns);
  }
}
