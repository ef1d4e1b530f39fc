/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.zabbixtools.zabbix.baseline.api.ZabbixQueryCapability;
import com.zabbixtools.zabbix.baseline.config.AlgorithmConfig;
import com.zabbixtools.zabbix.baseline.config.FilterConfiguration;
import com.zabbixtools.zabbix.baseline.config.ZabbixBaselineConfig;
import com.zabbixtools.zabbix.baseline.config.constants.ComparatorConfig;
import com.zabbixtools.zabbix.baseline.config.constants.DiscoveryConfig;
import com.zabbixtools.zabbix.baseline.detector.ComparisonResult;
import com.zabbixtools.zabbix.baseline.detector.WeekOverWeekComparator;
import com.zabbixtools.zabbix.baseline.discovery.DiscoveredItem;
import com.zabbixtools.zabbix.baseline.discovery.DiscoveryPipeline;
import com.zabbixtools.zabbix.baseline.discovery.DiscoveryResult;
import com.zabbixtools.zabbix.baseline.exception.DiscoveryException;
import com.zabbixtools.zabbix.baseline.exception.SamplingException;
import com.zabbixtools.zabbix.baseline.monitor.sampling.TemporalSampler;
import com.zabbixtools.zabbix.baseline.output.IngestionLineWriter;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.zabbixtools.zabbix.baseline.ZabbixBaselineUtils.COMPARATOR_SENSOR;
import static com.zabbixtools.zabbix.baseline.ZabbixBaselineUtils.DISCOVERY_SENSOR;


/**
 * One pass of the tool: discover the items, compare them one after another and write a line per item with a
 * deviation. An item without a usable result is skipped with a warning and never stops the run.
 */
public class ZabbixBaselineRunner {
  private static final Logger LOG = LoggerFactory.getLogger(ZabbixBaselineRunner.class);
  private final ZabbixQueryCapability _client;
  private final FilterConfiguration _filters;
  private final Clock _clock;
  private final boolean _includeAllHosts;
  private final int _historyFetchThreads;
  private final long _historyFetchTimeoutMs;
  private final long _runTimeoutMs;
  private final Timer _discoveryTimer;
  private final Timer _comparisonTimer;
  private final Meter _emittedItemRate;
  private final Meter _skippedItemRate;

  /**
   * @param config The configuration.
   * @param client An open query capability.
   * @param filters The filters to discover items with.
   * @param clock Clock giving "now" and measuring the run deadline.
   * @param dropwizardMetricRegistry Registry of the run metrics.
   */
  public ZabbixBaselineRunner(ZabbixBaselineConfig config,
                              ZabbixQueryCapability client,
                              FilterConfiguration filters,
                              Clock clock,
                              MetricRegistry dropwizardMetricRegistry) {
    _client = client;
    _filters = filters;
    _clock = clock;
    _includeAllHosts = config.getBoolean(DiscoveryConfig.INCLUDE_ALL_HOSTS_CONFIG);
    _historyFetchThreads = config.getInt(ComparatorConfig.HISTORY_FETCH_THREADS_CONFIG);
    _historyFetchTimeoutMs = config.getLong(ComparatorConfig.HISTORY_FETCH_TIMEOUT_MS_CONFIG);
    _runTimeoutMs = config.getLong(ComparatorConfig.RUN_TIMEOUT_MS_CONFIG);
    _discoveryTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(DISCOVERY_SENSOR, "discovery-timer"));
    _comparisonTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(COMPARATOR_SENSOR, "item-comparison-timer"));
    _emittedItemRate = dropwizardMetricRegistry.meter(MetricRegistry.name(COMPARATOR_SENSOR, "emitted-item-rate"));
    _skippedItemRate = dropwizardMetricRegistry.meter(MetricRegistry.name(COMPARATOR_SENSOR, "skipped-item-rate"));
  }

  /**
   * @param writer Destination of the ingestion lines, flushed before returning.
   * @return The item counts of the run.
   * @throws DiscoveryException If no host was resolved and scanning all hosts is disabled.
   * @throws IOException If the output could not be written.
   */
  public RunSummary run(IngestionLineWriter writer) throws DiscoveryException, IOException {
    long deadlineMs = _runTimeoutMs > 0 ? _clock.millis() + _runTimeoutMs : Long.MAX_VALUE;
    DiscoveryResult discovery;
    try (Timer.Context ignored = _discoveryTimer.time()) {
      discovery = new DiscoveryPipeline(_client).discover(_filters, _includeAllHosts);
    }

    int emitted = 0;
    int skipped = 0;
    int notStarted = 0;
    TemporalSampler sampler = new TemporalSampler(_client);
    try (WeekOverWeekComparator comparator = new WeekOverWeekComparator(sampler, _clock, _historyFetchThreads,
                                                                        _historyFetchTimeoutMs)) {
      for (DiscoveredItem item : discovery.items().entries().values()) {
        if (_clock.millis() >= deadlineMs) {
          if (notStarted == 0) {
            LOG.warn("The run deadline of {} ms has passed, skipping the remaining items.", _runTimeoutMs);
          }
          notStarted++;
          _skippedItemRate.mark();
          continue;
        }

        ComparisonResult result;
        try (Timer.Context ignored = _comparisonTimer.time()) {
          result = compare(comparator, item);
        } catch (SamplingException e) {
          LOG.warn("Skipping {}: {}", item, e.getMessage(), e);
          skipped++;
          _skippedItemRate.mark();
          continue;
        }
        if (!result.hasDeviation()) {
          LOG.warn("Skipping {}: no usable current sample or no historical sample to compare with.", item);
          skipped++;
          _skippedItemRate.mark();
          continue;
        }
        writer.write(result);
        emitted++;
        _emittedItemRate.mark();
      }
    }
    writer.flush();

    RunSummary summary = new RunSummary(discovery.items().size(), emitted, skipped, notStarted);
    LOG.info("Run completed: {}.", summary);
    return summary;
  }

  private static ComparisonResult compare(WeekOverWeekComparator comparator, DiscoveredItem item) throws SamplingException {
    AlgorithmConfig algorithm = item.algorithm();
    switch (algorithm.type()) {
      case WEEK_OVER_WEEK:
        return comparator.compare(item, algorithm.weeks(), algorithm.halfWidthSeconds());
      default:
        throw new IllegalStateException("Unsupported algorithm " + algorithm.type());
    }
  }
}
