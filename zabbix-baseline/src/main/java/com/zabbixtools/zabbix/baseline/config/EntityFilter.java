/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One filter on an entity kind. {@code filter} matches a field exactly against one of the accepted values,
 * {@code search} matches it against one of the accepted wildcard patterns. Either map may be {@code null}, meaning
 * the criterion is not sent.
 */
public class EntityFilter {
  private final EntityKind _kind;
  private final Map<String, List<String>> _filter;
  private final Map<String, List<String>> _search;

  public EntityFilter(EntityKind kind, Map<String, List<String>> filter, Map<String, List<String>> search) {
    _kind = kind;
    _filter = filter == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(filter));
    _search = search == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(search));
  }

  public EntityKind kind() {
    return _kind;
  }

  public Map<String, List<String>> filter() {
    return _filter;
  }

  public Map<String, List<String>> search() {
    return _search;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    EntityFilter that = (EntityFilter) o;
    return _kind == that._kind && Objects.equals(_filter, that._filter) && Objects.equals(_search, that._search);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_kind, _filter, _search);
  }

  @Override
  public String toString() {
    return String.format("%s{filter=%s, search=%s}", _kind, _filter, _search);
  }
}
