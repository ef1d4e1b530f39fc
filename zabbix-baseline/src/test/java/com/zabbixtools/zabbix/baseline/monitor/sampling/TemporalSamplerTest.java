/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.monitor.sampling;

import com.zabbixtools.zabbix.baseline.api.ZabbixQueryCapability;
import com.zabbixtools.zabbix.baseline.api.model.HistoryValue;
import com.zabbixtools.zabbix.baseline.config.AlgorithmConfig;
import com.zabbixtools.zabbix.baseline.config.AlgorithmType;
import com.zabbixtools.zabbix.baseline.discovery.DiscoveredItem;
import com.zabbixtools.zabbix.baseline.exception.SamplingException;
import com.zabbixtools.zabbix.baseline.exception.ZabbixApiException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.mock;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TemporalSamplerTest {
  private static final DiscoveredItem ITEM = new DiscoveredItem("23296", "10084", "web1", "system.cpu.load", 0,
                                                                new AlgorithmConfig(AlgorithmType.WEEK_OVER_WEEK, 3, 600L),
                                                                ".wow");
  private ZabbixQueryCapability _client;

  @Before
  public void setUp() {
    _client = mock(ZabbixQueryCapability.class);
  }

  @Test
  public void testQueriesSymmetricWindow() throws Exception {
    expect(_client.queryHistory("23296", 0, 1699999700L, 1700000300L))
        .andReturn(Arrays.asList(new HistoryValue("23296", "0.25", 1699999800L, 5L),
                                 new HistoryValue(null, "0.5", 1700000100L, 0L)));
    replay(_client);

    List<Sample> samples = new TemporalSampler(_client).fetchWindow(ITEM, 1700000000L, 300L);

    assertEquals(Arrays.asList(new Sample("23296", "0.25", 1699999800L, 5L),
                               new Sample("23296", "0.5", 1700000100L, 0L)), samples);
    verify(_client);
  }

  @Test
  public void testEmptyWindow() throws Exception {
    expect(_client.queryHistory("23296", 0, 900L, 1100L)).andReturn(Collections.emptyList());
    replay(_client);

    assertTrue(new TemporalSampler(_client).fetchWindow(ITEM, 1000L, 100L).isEmpty());
    verify(_client);
  }

  @Test(expected = SamplingException.class)
  public void testQueryFailure() throws Exception {
    expect(_client.queryHistory("23296", 0, 900L, 1100L)).andThrow(new ZabbixApiException("Connection refused"));
    replay(_client);

    new TemporalSampler(_client).fetchWindow(ITEM, 1000L, 100L);
  }
}
