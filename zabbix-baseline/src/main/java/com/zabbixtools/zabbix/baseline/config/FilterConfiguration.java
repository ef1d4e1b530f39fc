/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

import java.util.Collections;
import java.util.List;

/**
 * The validated content of the filter file.
 */
public class FilterConfiguration {
  private final List<EntityFilter> _templateFilters;
  private final List<EntityFilter> _hostFilters;
  private final List<ItemFilter> _itemFilters;

  public FilterConfiguration(List<EntityFilter> templateFilters, List<EntityFilter> hostFilters, List<ItemFilter> itemFilters) {
    _templateFilters = Collections.unmodifiableList(templateFilters);
    _hostFilters = Collections.unmodifiableList(hostFilters);
    _itemFilters = Collections.unmodifiableList(itemFilters);
  }

  public List<EntityFilter> templateFilters() {
    return _templateFilters;
  }

  public List<EntityFilter> hostFilters() {
    return _hostFilters;
  }

  public List<ItemFilter> itemFilters() {
    return _itemFilters;
  }

  @Override
  public String toString() {
    return String.format("FilterConfiguration{templates=%d, hosts=%d, items=%d}",
                         _templateFilters.size(), _hostFilters.size(), _itemFilters.size());
  }
}
