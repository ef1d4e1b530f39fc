/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

import com.zabbixtools.baseline.common.config.ConfigException;
import java.util.Objects;

/**
 * The algorithm of an item filter: its type, how many weeks to look back and the full window width in seconds.
 */
public final class AlgorithmConfig {
  public static final long MIN_WINDOW_SECONDS = 2L;
  private final AlgorithmType _type;
  private final int _weeks;
  private final long _windowSeconds;

  /**
   * @param type Algorithm type.
   * @param weeks Number of previous weeks to compare against, positive.
   * @param windowSeconds Full width of the sampling window in seconds, at least {@link #MIN_WINDOW_SECONDS}.
   */
  public AlgorithmConfig(AlgorithmType type, int weeks, long windowSeconds) {
    if (type == null) {
      throw new ConfigException("Algorithm type is required.");
    }
    if (weeks <= 0) {
      throw new ConfigException("weeks", weeks, "Must be positive.");
    }
    if (windowSeconds < MIN_WINDOW_SECONDS) {
      throw new ConfigException("window", windowSeconds, "Must be at least " + MIN_WINDOW_SECONDS
                                                         + " seconds so that the half-width is not zero.");
    }
    _type = type;
    _weeks = weeks;
    _windowSeconds = windowSeconds;
  }

  public AlgorithmType type() {
    return _type;
  }

  public int weeks() {
    return _weeks;
  }

  public long windowSeconds() {
    return _windowSeconds;
  }

  /**
   * @return Half of the window, the distance sampled on each side of an instant.
   */
  public long halfWidthSeconds() {
    return _windowSeconds / 2;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AlgorithmConfig that = (AlgorithmConfig) o;
    return _weeks == that._weeks && _windowSeconds == that._windowSeconds && _type == that._type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_type, _weeks, _windowSeconds);
  }

  @Override
  public String toString() {
    return String.format("%s{weeks=%d, window=%ds}", _type, _weeks, _windowSeconds);
  }
}
