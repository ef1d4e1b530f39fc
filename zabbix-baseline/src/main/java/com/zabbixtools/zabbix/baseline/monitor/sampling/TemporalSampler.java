/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.monitor.sampling;

import com.zabbixtools.zabbix.baseline.api.ZabbixQueryCapability;
import com.zabbixtools.zabbix.baseline.api.model.HistoryValue;
import com.zabbixtools.zabbix.baseline.discovery.DiscoveredItem;
import com.zabbixtools.zabbix.baseline.exception.SamplingException;
import com.zabbixtools.zabbix.baseline.exception.ZabbixApiException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.zabbixtools.baseline.BaselineUtils.utcDateFor;
import static com.zabbixtools.baseline.common.utils.Utils.validateNotNull;

/**
 * Fetches the samples of an item within a symmetric window {@code [instant - halfWidth, instant + halfWidth]}.
 */
public class TemporalSampler {
  private static final Logger LOG = LoggerFactory.getLogger(TemporalSampler.class);
  private final ZabbixQueryCapability _client;

  public TemporalSampler(ZabbixQueryCapability client) {
    _client = validateNotNull(client, "client cannot be null.");
  }

  /**
   * Issues exactly one history query.
   *
   * @param item The item to sample.
   * @param instantEpochSeconds Center of the window.
   * @param halfWidthSeconds Distance sampled on each side of the center.
   * @return The samples in the window, oldest first, empty if there is none.
   * @throws SamplingException If the history could not be queried.
   */
  public List<Sample> fetchWindow(DiscoveredItem item, long instantEpochSeconds, long halfWidthSeconds)
      throws SamplingException {
    long from = instantEpochSeconds - halfWidthSeconds;
    long till = instantEpochSeconds + halfWidthSeconds;
    List<HistoryValue> history;
    try {
      history = _client.queryHistory(item.itemId(), item.valueType(), from, till);
    } catch (ZabbixApiException e) {
      throw new SamplingException(String.format("Failed to fetch the history of %s between %s and %s.",
                                                item, utcDateFor(from), utcDateFor(till)), e);
    }

    List<Sample> samples = new ArrayList<>(history.size());
    for (HistoryValue value : history) {
      try {
        samples.add(new Sample(value.itemId() == null ? item.itemId() : value.itemId(), value.value(), value.clock(), value.ns()));
      } catch (NumberFormatException e) {
        LOG.warn("Ignoring history record {} of {} with a malformed clock.", value, item);
      }
    }
    LOG.trace("Fetched {} samples of {} around {}.", samples.size(), item, utcDateFor(instantEpochSeconds));
    return samples;
  }
}
