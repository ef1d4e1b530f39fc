/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.monitor.sampling;

import java.util.List;

/**
 * Selects the sample nearest to a target instant.
 */
public final class ClosestSampleSelector {
  /**
   * A sample at this distance or further from the target is never selected.
   */
  public static final long MAX_DISTANCE_SECONDS = 365L * 24 * 3600;

  private ClosestSampleSelector() {

  }

  /**
   * A sample replaces the current best only if it is strictly closer, so on ties the first one in scan order wins.
   *
   * @param targetEpochSeconds The target instant.
   * @param samples Candidate samples, in any order.
   * @return The closest sample, or {@code null} if none is closer than {@link #MAX_DISTANCE_SECONDS}.
   */
  public static Sample closest(long targetEpochSeconds, List<Sample> samples) {
    Sample best = null;
    long bestDistance = MAX_DISTANCE_SECONDS;
    for (Sample sample : samples) {
      long distance = Math.abs(targetEpochSeconds - sample.clock());
      if (distance < bestDistance) {
        best = sample;
        bestDistance = distance;
      }
    }
    return best;
  }
}
