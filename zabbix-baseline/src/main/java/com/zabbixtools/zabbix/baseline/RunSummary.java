/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline;

/**
 * Item counts of one run.
 */
public final class RunSummary {
  private final int _discovered;
  private final int _emitted;
  private final int _skipped;
  private final int _notStarted;

  public RunSummary(int discovered, int emitted, int skipped, int notStarted) {
    _discovered = discovered;
    _emitted = emitted;
    _skipped = skipped;
    _notStarted = notStarted;
  }

  public int discovered() {
    return _discovered;
  }

  /**
   * @return Items written to the output.
   */
  public int emitted() {
    return _emitted;
  }

  /**
   * @return Items compared without a usable result, or whose sampling failed.
   */
  public int skipped() {
    return _skipped;
  }

  /**
   * @return Items not compared because the run deadline passed.
   */
  public int notStarted() {
    return _notStarted;
  }

  @Override
  public String toString() {
    return String.format("%d items discovered, %d emitted, %d skipped, %d not started before the deadline",
                         _discovered, _emitted, _skipped, _notStarted);
  }
}
