/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.detector;

import com.zabbixtools.zabbix.baseline.api.ZabbixQueryCapability;
import com.zabbixtools.zabbix.baseline.api.model.HistoryValue;
import com.zabbixtools.zabbix.baseline.config.AlgorithmConfig;
import com.zabbixtools.zabbix.baseline.config.AlgorithmType;
import com.zabbixtools.zabbix.baseline.discovery.DiscoveredItem;
import com.zabbixtools.zabbix.baseline.exception.ZabbixApiException;
import com.zabbixtools.zabbix.baseline.monitor.sampling.TemporalSampler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.easymock.IExpectationSetters;
import org.junit.Before;
import org.junit.Test;

import static com.zabbixtools.zabbix.baseline.ZabbixBaselineUtils.SECONDS_PER_WEEK;
import static org.easymock.EasyMock.anyInt;
import static org.easymock.EasyMock.anyLong;
import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.getCurrentArguments;
import static org.easymock.EasyMock.mock;
import static org.easymock.EasyMock.replay;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class WeekOverWeekComparatorTest {
  private static final long NOW = 1700000000L;
  private static final long HALF_WIDTH = 300L;
  private static final String ITEM_ID = "23296";
  private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
  private static final DiscoveredItem ITEM = new DiscoveredItem(ITEM_ID, "10084", "web1", "system.cpu.load", 0,
                                                                new AlgorithmConfig(AlgorithmType.WEEK_OVER_WEEK, 3, 600L),
                                                                ".wow");
  private ZabbixQueryCapability _client;

  @Before
  public void setUp() {
    _client = mock(ZabbixQueryCapability.class);
  }

  @Test
  public void testWeekAnchors() {
    assertArrayEquals(new long[]{NOW - SECONDS_PER_WEEK, NOW - 2 * SECONDS_PER_WEEK, NOW - 3 * SECONDS_PER_WEEK},
                      WeekOverWeekComparator.weekAnchors(NOW, 3));
    assertEquals(0, WeekOverWeekComparator.weekAnchors(NOW, 0).length);
  }

  @Test
  public void testMean() {
    assertEquals(15.0, WeekOverWeekComparator.mean(Arrays.asList(10.0, 20.0)), 1e-9);
    assertTrue(Double.isNaN(WeekOverWeekComparator.mean(Collections.emptyList())));
  }

  @Test
  public void testMissingWeekIsLeftOutOfBaseline() throws Exception {
    long anchor = NOW - 40;
    expectWindow(NOW, history(anchor, "30"));
    expectWindow(anchor - SECONDS_PER_WEEK, history(anchor - SECONDS_PER_WEEK + 20, "10"));
    expectWindow(anchor - 2 * SECONDS_PER_WEEK, Collections.emptyList());
    expectWindow(anchor - 3 * SECONDS_PER_WEEK, history(anchor - 3 * SECONDS_PER_WEEK - 10, "20"));
    replay(_client);

    ComparisonResult result = compare(1);

    assertEquals(new ComparisonResult("web1", "system.cpu.load", ".wow", anchor, 15.0, 2), result);
    assertTrue(result.hasDeviation());
  }

  @Test
  public void testCurrentSampleClosestToNowIsUsed() throws Exception {
    expectWindow(NOW, Arrays.asList(new HistoryValue(ITEM_ID, "100", NOW - 250, 0L),
                                    new HistoryValue(ITEM_ID, "40", NOW + 10, 0L),
                                    new HistoryValue(ITEM_ID, "70", NOW + 200, 0L)));
    for (int week = 1; week <= 3; week++) {
      long anchor = NOW + 10 - week * SECONDS_PER_WEEK;
      expectWindow(anchor, history(anchor, String.valueOf(10 * week)));
    }
    replay(_client);

    ComparisonResult result = compare(1);

    assertEquals(NOW + 10, result.timestamp());
    assertEquals(40.0 - 20.0, result.deviation(), 1e-9);
    assertEquals(3, result.historicalSampleCount());
  }

  @Test
  public void testNoCurrentSample() throws Exception {
    expectWindow(NOW, Collections.emptyList());
    replay(_client);

    ComparisonResult result = compare(1);

    assertFalse(result.hasDeviation());
    assertEquals(NOW, result.timestamp());
    assertEquals(0, result.historicalSampleCount());
  }

  @Test
  public void testNonNumericCurrentSample() throws Exception {
    expectWindow(NOW, history(NOW, "down"));
    replay(_client);

    assertFalse(compare(1).hasDeviation());
  }

  @Test
  public void testNoHistoricalSample() throws Exception {
    expectWindow(NOW, history(NOW, "5"));
    for (int week = 1; week <= 3; week++) {
      expectWindow(NOW - week * SECONDS_PER_WEEK, Collections.emptyList());
    }
    replay(_client);

    ComparisonResult result = compare(1);

    assertFalse(result.hasDeviation());
    assertEquals(0, result.historicalSampleCount());
  }

  @Test
  public void testFailedWeekIsSkipped() throws Exception {
    expectWindow(NOW, history(NOW, "12"));
    expectWindow(NOW - SECONDS_PER_WEEK, history(NOW - SECONDS_PER_WEEK, "4"));
    expect(_client.queryHistory(ITEM_ID, 0, NOW - 2 * SECONDS_PER_WEEK - HALF_WIDTH, NOW - 2 * SECONDS_PER_WEEK + HALF_WIDTH))
        .andThrow(new ZabbixApiException("Read timed out"));
    expectWindow(NOW - 3 * SECONDS_PER_WEEK, history(NOW - 3 * SECONDS_PER_WEEK, "non-numeric"));
    replay(_client);

    ComparisonResult result = compare(1);

    assertEquals(8.0, result.deviation(), 1e-9);
    assertEquals(1, result.historicalSampleCount());
  }

  @Test
  public void testResultDoesNotDependOnThreadCount() throws Exception {
    // Every window answers with a sample at its center, valued by how many weeks back it is.
    expect(_client.queryHistory(anyString(), anyInt(), anyLong(), anyLong())).andAnswer(() -> {
      long from = (Long) getCurrentArguments()[2];
      long center = from + HALF_WIDTH;
      return history(center, String.valueOf((NOW - center) / SECONDS_PER_WEEK));
    }).anyTimes();
    replay(_client);

    ComparisonResult sequential = compare(1);
    ComparisonResult concurrent = compare(4);

    assertEquals(sequential, concurrent);
    assertEquals(0.0 - 2.0, concurrent.deviation(), 1e-9);
  }

  @Test
  public void testWeekQueuedBehindStuckFetchIsStillFetched() throws Exception {
    expectWindow(NOW, history(NOW, "12"));
    // The first week ignores the cancellation and keeps the only history fetcher busy past its timeout.
    expect(_client.queryHistory(ITEM_ID, 0, NOW - SECONDS_PER_WEEK - HALF_WIDTH, NOW - SECONDS_PER_WEEK + HALF_WIDTH))
        .andAnswer(() -> {
          busyWait(400L);
          return history(NOW - SECONDS_PER_WEEK, "100");
        });
    expectWindow(NOW - 2 * SECONDS_PER_WEEK, history(NOW - 2 * SECONDS_PER_WEEK, "4"));
    expectWindow(NOW - 3 * SECONDS_PER_WEEK, history(NOW - 3 * SECONDS_PER_WEEK, "8"));
    replay(_client);

    ComparisonResult result = compare(1, 250L);

    assertEquals(2, result.historicalSampleCount());
    assertEquals(12.0 - 6.0, result.deviation(), 1e-9);
  }

  @Test
  public void testWeeksNeverStartedAreSkipped() throws Exception {
    expectWindow(NOW, history(NOW, "12"));
    expect(_client.queryHistory(ITEM_ID, 0, NOW - SECONDS_PER_WEEK - HALF_WIDTH, NOW - SECONDS_PER_WEEK + HALF_WIDTH))
        .andAnswer(() -> {
          busyWait(1000L);
          return history(NOW - SECONDS_PER_WEEK, "100");
        });
    expectWindow(NOW - 2 * SECONDS_PER_WEEK, history(NOW - 2 * SECONDS_PER_WEEK, "4")).anyTimes();
    expectWindow(NOW - 3 * SECONDS_PER_WEEK, history(NOW - 3 * SECONDS_PER_WEEK, "8")).anyTimes();
    replay(_client);

    long start = System.nanoTime();
    ComparisonResult result = compare(1, 100L);

    assertFalse(result.hasDeviation());
    assertEquals(0, result.historicalSampleCount());
    assertTrue(System.nanoTime() - start < TimeUnit.MILLISECONDS.toNanos(1000L));
  }

  private ComparisonResult compare(int threads) throws Exception {
    return compare(threads, 10000L);
  }

  private ComparisonResult compare(int threads, long timeoutMs) throws Exception {
    try (WeekOverWeekComparator comparator = new WeekOverWeekComparator(new TemporalSampler(_client), CLOCK, threads, timeoutMs)) {
      return comparator.compare(ITEM, 3, HALF_WIDTH);
    }
  }

  private IExpectationSetters<List<HistoryValue>> expectWindow(long center, List<HistoryValue> history)
      throws ZabbixApiException {
    return expect(_client.queryHistory(ITEM_ID, 0, center - HALF_WIDTH, center + HALF_WIDTH)).andReturn(history);
  }

  /**
   * Spins without sleeping, so that interrupting the thread does not end the wait.
   */
  private static void busyWait(long millis) {
    long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    while (System.nanoTime() < until) {
      Thread.yield();
    }
  }

  private static List<HistoryValue> history(long clock, String value) {
    return Collections.singletonList(new HistoryValue(ITEM_ID, value, clock, 0L));
  }
}
