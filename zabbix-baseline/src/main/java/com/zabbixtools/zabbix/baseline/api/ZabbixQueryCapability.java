/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api;

import com.zabbixtools.baseline.common.BaselineConfigurable;
import com.zabbixtools.zabbix.baseline.api.model.HistoryValue;
import com.zabbixtools.zabbix.baseline.api.model.HostElement;
import com.zabbixtools.zabbix.baseline.api.model.ItemElement;
import com.zabbixtools.zabbix.baseline.api.model.TemplateElement;
import com.zabbixtools.zabbix.baseline.exception.ZabbixApiException;
import java.io.Closeable;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * The typed queries discovery and sampling need from a Zabbix server. Every call is synchronous and returns a
 * possibly empty list, or throws {@link ZabbixApiException} if the call could not be completed.
 *
 * Filter and search maps go from a field name to the accepted values; {@code null} means no criterion.
 * Implementations must be safe for concurrent {@link #queryHistory} calls.
 */
public interface ZabbixQueryCapability extends BaselineConfigurable, Closeable {

  /**
   * Open the API session. Must be called once before any query.
   */
  void open() throws ZabbixApiException;

  List<TemplateElement> queryTemplates(Map<String, List<String>> filter, Map<String, List<String>> search)
      throws ZabbixApiException;

  /**
   * @param templateIds Restrict to hosts linked to one of these templates, {@code null} or empty for no restriction.
   */
  List<HostElement> queryHosts(Collection<String> templateIds, Map<String, List<String>> filter, Map<String, List<String>> search)
      throws ZabbixApiException;

  /**
   * @param hostIds Restrict to items of these hosts, {@code null} to query the items of all hosts.
   */
  List<ItemElement> queryItems(Collection<String> hostIds, Map<String, List<String>> filter, Map<String, List<String>> search)
      throws ZabbixApiException;

  /**
   * @param itemId Item to read.
   * @param valueType Value type of the item.
   * @param fromEpochSeconds Inclusive range start.
   * @param toEpochSeconds Inclusive range end.
   * @return The records in the range, oldest first.
   */
  List<HistoryValue> queryHistory(String itemId, int valueType, long fromEpochSeconds, long toEpochSeconds)
      throws ZabbixApiException;
}
