/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.detector;

import com.zabbixtools.baseline.common.BaselineThreadFactory;
import com.zabbixtools.zabbix.baseline.discovery.DiscoveredItem;
import com.zabbixtools.zabbix.baseline.exception.SamplingException;
import com.zabbixtools.zabbix.baseline.monitor.sampling.ClosestSampleSelector;
import com.zabbixtools.zabbix.baseline.monitor.sampling.Sample;
import com.zabbixtools.zabbix.baseline.monitor.sampling.TemporalSampler;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.zabbixtools.baseline.BaselineUtils.utcDateFor;
import static com.zabbixtools.baseline.common.utils.Utils.validateNotNull;
import static com.zabbixtools.zabbix.baseline.ZabbixBaselineUtils.SECONDS_PER_WEEK;

/**
 * Compares the current sample of an item with the samples taken at the same time of day in previous weeks.
 *
 * <ol>
 *   <li>The current sample is the one closest to now within the window around now.</li>
 *   <li>Its clock is the anchor. Week {@code i} is sampled around {@code anchor - i * 604800}.</li>
 *   <li>The baseline is the mean of the weeks that have a usable closest sample. Other weeks are left out, never
 *   counted as zero.</li>
 *   <li>The deviation is the current value minus the baseline.</li>
 * </ol>
 *
 * Historical weeks are fetched concurrently on a bounded pool and collected by week index so that the result does not
 * depend on the pool size. The timeout of a week runs from the moment its fetch starts. A week still queued behind
 * other fetches waits at most {@code ceil(weeks / threads) * timeout} from submission before it is given up.
 */
public class WeekOverWeekComparator implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(WeekOverWeekComparator.class);
  private final TemporalSampler _sampler;
  private final Clock _clock;
  private final int _historyFetchThreads;
  private final long _historyFetchTimeoutMs;
  private final ExecutorService _historyFetchExecutor;

  /**
   * @param sampler Sampler to fetch the windows with.
   * @param clock Clock giving "now".
   * @param historyFetchThreads Number of weeks fetched concurrently.
   * @param historyFetchTimeoutMs Maximum time to wait for one week once its fetch has started.
   */
  public WeekOverWeekComparator(TemporalSampler sampler, Clock clock, int historyFetchThreads, long historyFetchTimeoutMs) {
    if (historyFetchThreads < 1) {
      throw new IllegalArgumentException("historyFetchThreads must be positive, provided " + historyFetchThreads);
    }
    _sampler = validateNotNull(sampler, "sampler cannot be null.");
    _clock = validateNotNull(clock, "clock cannot be null.");
    _historyFetchThreads = historyFetchThreads;
    _historyFetchTimeoutMs = historyFetchTimeoutMs;
    _historyFetchExecutor = Executors.newFixedThreadPool(historyFetchThreads, new BaselineThreadFactory("HistoryFetcher"));
  }

  /**
   * @param item The item to compare.
   * @param weekCount Number of previous weeks forming the baseline.
   * @param halfWidthSeconds Distance sampled on each side of now and of every weekly anchor.
   * @return The comparison, with a NaN deviation if there is no usable current sample or no historical sample.
   * @throws SamplingException If the current window could not be fetched.
   */
  public ComparisonResult compare(DiscoveredItem item, int weekCount, long halfWidthSeconds) throws SamplingException {
    long now = _clock.instant().getEpochSecond();
    Sample current = ClosestSampleSelector.closest(now, _sampler.fetchWindow(item, now, halfWidthSeconds));
    Double currentValue = current == null ? null : current.numericValue();
    if (currentValue == null) {
      LOG.debug("No usable current sample of {} around {}: {}.", item, utcDateFor(now), current);
      return new ComparisonResult(item.hostName(), item.key(), item.postfix(), now, Double.NaN, 0);
    }

    List<Double> historicalValues = fetchHistoricalValues(item, weekAnchors(current.clock(), weekCount), halfWidthSeconds);
    double baseline = mean(historicalValues);
    LOG.debug("{}: current {} at {}, baseline {} over {} of {} weeks.", item, currentValue, utcDateFor(current.clock()),
              baseline, historicalValues.size(), weekCount);
    return new ComparisonResult(item.hostName(), item.key(), item.postfix(), current.clock(), currentValue - baseline,
                                historicalValues.size());
  }

  /**
   * @param anchorEpochSeconds Clock of the current sample.
   * @param weekCount Number of previous weeks.
   * @return {@code anchor - i * 604800} for {@code i = 1..weekCount}, most recent week first.
   */
  public static long[] weekAnchors(long anchorEpochSeconds, int weekCount) {
    long[] anchors = new long[weekCount];
    for (int i = 1; i <= weekCount; i++) {
      anchors[i - 1] = anchorEpochSeconds - i * SECONDS_PER_WEEK;
    }
    return anchors;
  }

  /**
   * @param values Values to average.
   * @return The arithmetic mean, NaN if there is no value.
   */
  public static double mean(List<Double> values) {
    if (values.isEmpty()) {
      return Double.NaN;
    }
    DescriptiveStatistics statistics = new DescriptiveStatistics();
    for (double value : values) {
      statistics.addValue(value);
    }
    return statistics.getMean();
  }

  private List<Double> fetchHistoricalValues(DiscoveredItem item, long[] anchors, long halfWidthSeconds)
      throws SamplingException {
    long timeoutNs = TimeUnit.MILLISECONDS.toNanos(_historyFetchTimeoutMs);
    long rounds = (anchors.length + _historyFetchThreads - 1) / _historyFetchThreads;
    long startDeadlineNs = System.nanoTime() + rounds * timeoutNs;
    List<WeekFetch> fetches = new ArrayList<>(anchors.length);
    List<Future<Double>> futures = new ArrayList<>(anchors.length);
    for (long anchor : anchors) {
      WeekFetch fetch = new WeekFetch(() -> historicalValue(item, anchor, halfWidthSeconds));
      fetches.add(fetch);
      futures.add(_historyFetchExecutor.submit(fetch));
    }

    Double[] valuesByWeek = new Double[anchors.length];
    for (int week = 0; week < anchors.length; week++) {
      WeekFetch fetch = fetches.get(week);
      Future<Double> future = futures.get(week);
      try {
        if (!fetch.awaitStart(startDeadlineNs - System.nanoTime())) {
          future.cancel(true);
          LOG.warn("Skipping week {} of {}: its fetch did not start within {} ms, the history fetchers are busy.",
                   week + 1, item, TimeUnit.NANOSECONDS.toMillis(rounds * timeoutNs));
          continue;
        }
        valuesByWeek[week] = future.get(Math.max(0L, fetch.startNs() + timeoutNs - System.nanoTime()),
                                        TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        future.cancel(true);
        LOG.warn("Skipping week {} of {}: no history within {} ms.", week + 1, item, _historyFetchTimeoutMs);
      } catch (ExecutionException e) {
        LOG.warn("Skipping week {} of {}: {}", week + 1, item, e.getCause().getMessage(), e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(f -> f.cancel(true));
        throw new SamplingException("Interrupted while fetching the history of " + item, e);
      }
    }

    List<Double> values = new ArrayList<>(anchors.length);
    for (Double value : valuesByWeek) {
      if (value != null) {
        values.add(value);
      }
    }
    return values;
  }

  private Double historicalValue(DiscoveredItem item, long anchor, long halfWidthSeconds) throws SamplingException {
    Sample match = ClosestSampleSelector.closest(anchor, _sampler.fetchWindow(item, anchor, halfWidthSeconds));
    if (match == null) {
      LOG.debug("No sample of {} around {}.", item, utcDateFor(anchor));
      return null;
    }
    Double value = match.numericValue();
    if (value == null) {
      LOG.debug("Ignoring non-numeric sample {} of {}.", match, item);
    }
    return value;
  }

  @Override
  public void close() {
    _historyFetchExecutor.shutdownNow();
  }

  /**
   * The fetch of one week, recording when a history fetcher picked it up.
   */
  private static final class WeekFetch implements Callable<Double> {
    private final Callable<Double> _fetch;
    private final CountDownLatch _started;
    private volatile long _startNs;

    private WeekFetch(Callable<Double> fetch) {
      _fetch = fetch;
      _started = new CountDownLatch(1);
    }

    @Override
    public Double call() throws Exception {
      _startNs = System.nanoTime();
      _started.countDown();
      return _fetch.call();
    }

    /**
     * @return {@code true} if the fetch started within the given time.
     */
    private boolean awaitStart(long timeoutNs) throws InterruptedException {
      return _started.await(Math.max(0L, timeoutNs), TimeUnit.NANOSECONDS);
    }

    private long startNs() {
      return _startNs;
    }
  }
}
