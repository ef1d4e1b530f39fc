/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.discovery;

import com.zabbixtools.zabbix.baseline.api.ZabbixQueryCapability;
import com.zabbixtools.zabbix.baseline.api.model.HostElement;
import com.zabbixtools.zabbix.baseline.api.model.ItemElement;
import com.zabbixtools.zabbix.baseline.api.model.TemplateElement;
import com.zabbixtools.zabbix.baseline.config.AlgorithmConfig;
import com.zabbixtools.zabbix.baseline.config.AlgorithmType;
import com.zabbixtools.zabbix.baseline.config.EntityFilter;
import com.zabbixtools.zabbix.baseline.config.EntityKind;
import com.zabbixtools.zabbix.baseline.config.FilterConfiguration;
import com.zabbixtools.zabbix.baseline.config.ItemFilter;
import com.zabbixtools.zabbix.baseline.exception.DiscoveryException;
import com.zabbixtools.zabbix.baseline.exception.ZabbixApiException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.mock;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class DiscoveryPipelineTest {
  private static final Map<String, List<String>> TEMPLATE_CRITERIA =
      Collections.singletonMap("host", Collections.singletonList("Template OS Linux"));
  private static final Map<String, List<String>> HOST_CRITERIA =
      Collections.singletonMap("host", Collections.singletonList("web*"));
  private static final Map<String, List<String>> CPU_CRITERIA =
      Collections.singletonMap("key_", Collections.singletonList("system.cpu.load*"));
  private static final Map<String, List<String>> NET_CRITERIA =
      Collections.singletonMap("key_", Collections.singletonList("net.if.in*"));
  private static final AlgorithmConfig THREE_WEEKS = new AlgorithmConfig(AlgorithmType.WEEK_OVER_WEEK, 3, 600L);
  private static final AlgorithmConfig FOUR_WEEKS = new AlgorithmConfig(AlgorithmType.WEEK_OVER_WEEK, 4, 1200L);
  private static final EntityFilter TEMPLATE_FILTER = new EntityFilter(EntityKind.TEMPLATE, TEMPLATE_CRITERIA, null);
  private static final EntityFilter HOST_FILTER = new EntityFilter(EntityKind.HOST, null, HOST_CRITERIA);
  private static final ItemFilter CPU_FILTER = new ItemFilter(null, CPU_CRITERIA, THREE_WEEKS, ".wow");
  private static final ItemFilter NET_FILTER = new ItemFilter(null, NET_CRITERIA, FOUR_WEEKS, ".wow4");
  private ZabbixQueryCapability _client;

  @Before
  public void setUp() {
    _client = mock(ZabbixQueryCapability.class);
  }

  @Test
  public void testHostReachedThroughTemplateAndFilterIsCataloguedOnce() throws Exception {
    expect(_client.queryTemplates(TEMPLATE_CRITERIA, null))
        .andReturn(Collections.singletonList(new TemplateElement("10001", "Template OS Linux", "Linux")));
    expect(_client.queryHosts(Collections.singleton("10001"), null, null))
        .andReturn(Collections.singletonList(new HostElement("10084", "web1", "Web 1")));
    expect(_client.queryHosts(null, null, HOST_CRITERIA))
        .andReturn(Arrays.asList(new HostElement("10084", "web1", "Web 1"), new HostElement("10085", "web2", "")));
    expect(_client.queryItems(new HashSet<>(Arrays.asList("10084", "10085")), null, CPU_CRITERIA))
        .andReturn(Arrays.asList(new ItemElement("23296", "10084", "system.cpu.load[all,avg1]", "0", "Load"),
                                 new ItemElement("23297", "10085", "system.cpu.load[all,avg1]", "0", "Load")));
    replay(_client);

    DiscoveryResult result = new DiscoveryPipeline(_client).discover(
        new FilterConfiguration(Collections.singletonList(TEMPLATE_FILTER), Collections.singletonList(HOST_FILTER),
                                Collections.singletonList(CPU_FILTER)), false);

    assertEquals(1, result.templates().size());
    assertEquals(2, result.hosts().size());
    assertEquals(2, result.items().size());
    assertEquals(new DiscoveredItem("23297", "10085", "web2", "system.cpu.load[all,avg1]", 0, THREE_WEEKS, ".wow"),
                 result.items().get("23297"));
    assertTrue(result.items().isFrozen());
    verify(_client);
  }

  @Test
  public void testLastMatchingItemFilterWins() throws Exception {
    expect(_client.queryHosts(null, null, HOST_CRITERIA))
        .andReturn(Collections.singletonList(new HostElement("10084", "web1", "Web 1")));
    expect(_client.queryItems(Collections.singleton("10084"), null, CPU_CRITERIA))
        .andReturn(Collections.singletonList(new ItemElement("23296", "10084", "net.if.in[eth0]", "3", "In")));
    expect(_client.queryItems(Collections.singleton("10084"), null, NET_CRITERIA))
        .andReturn(Collections.singletonList(new ItemElement("23296", "10084", "net.if.in[eth0]", "3", "In")));
    replay(_client);

    DiscoveryResult result = new DiscoveryPipeline(_client).discover(
        new FilterConfiguration(Collections.emptyList(), Collections.singletonList(HOST_FILTER),
                                Arrays.asList(CPU_FILTER, NET_FILTER)), false);

    DiscoveredItem item = result.items().get("23296");
    assertEquals(1, result.items().size());
    assertEquals(FOUR_WEEKS, item.algorithm());
    assertEquals(".wow4", item.postfix());
    assertEquals(3, item.valueType());
  }

  @Test(expected = DiscoveryException.class)
  public void testNoHostIsAnError() throws Exception {
    expect(_client.queryTemplates(TEMPLATE_CRITERIA, null)).andReturn(Collections.emptyList());
    expect(_client.queryHosts(null, null, HOST_CRITERIA)).andReturn(Collections.emptyList());
    replay(_client);

    new DiscoveryPipeline(_client).discover(
        new FilterConfiguration(Collections.singletonList(TEMPLATE_FILTER), Collections.singletonList(HOST_FILTER),
                                Collections.singletonList(CPU_FILTER)), false);
  }

  @Test
  public void testAllHostsAreScannedWhenEnabled() throws Exception {
    expect(_client.queryItems(null, null, CPU_CRITERIA))
        .andReturn(Arrays.asList(new ItemElement("23296", "10090", "system.cpu.load", "0", "Load"),
                                 new ItemElement("23297", "10091", "system.cpu.load", "0", "Load")));
    expect(_client.queryHosts(null, Collections.singletonMap(DiscoveryPipeline.HOST_ID_FIELD, Arrays.asList("10090", "10091")),
                              null))
        .andReturn(Collections.singletonList(new HostElement("10090", "db1", "Database 1")));
    replay(_client);

    DiscoveryResult result = new DiscoveryPipeline(_client).discover(
        new FilterConfiguration(Collections.emptyList(), Collections.emptyList(), Collections.singletonList(CPU_FILTER)),
        true);

    assertEquals(1, result.items().size());
    assertEquals("db1", result.items().get("23296").hostName());
    assertNull(result.items().get("23297"));
    assertEquals("db1", result.hosts().get("10090"));
    verify(_client);
  }

  @Test
  public void testFailedQueriesDoNotStopDiscovery() throws Exception {
    expect(_client.queryTemplates(TEMPLATE_CRITERIA, null)).andThrow(new ZabbixApiException("Read timed out"));
    expect(_client.queryHosts(null, null, HOST_CRITERIA))
        .andReturn(Collections.singletonList(new HostElement("10084", "web1", "Web 1")));
    expect(_client.queryItems(Collections.singleton("10084"), null, CPU_CRITERIA))
        .andThrow(new ZabbixApiException("Invalid params.", -32602, "Incorrect search field."));
    expect(_client.queryItems(Collections.singleton("10084"), null, NET_CRITERIA))
        .andReturn(Arrays.asList(new ItemElement("23298", "10084", "net.if.in[eth0]", "3", "In"),
                                 new ItemElement("23299", "10084", "net.if.in[eth1]", "x", "In")));
    replay(_client);

    DiscoveryResult result = new DiscoveryPipeline(_client).discover(
        new FilterConfiguration(Collections.singletonList(TEMPLATE_FILTER), Collections.singletonList(HOST_FILTER),
                                Arrays.asList(CPU_FILTER, NET_FILTER)), false);

    assertTrue(result.templates().isEmpty());
    assertEquals(Collections.singleton("23298"), result.items().ids());
    verify(_client);
  }
}
