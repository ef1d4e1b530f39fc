/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The kinds of Zabbix entities a filter can target, each with the object fields a filter may reference.
 */
public enum EntityKind {
  TEMPLATE("templates", "templateid", "host", "name"),
  HOST("hosts", "hostid", "host", "name", "status", "proxy_hostid"),
  ITEM("items", "itemid", "hostid", "key_", "name", "value_type", "status", "type", "delay");

  private final String _section;
  private final Set<String> _recognizedFields;

  EntityKind(String section, String... recognizedFields) {
    _section = section;
    _recognizedFields = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(recognizedFields)));
  }

  /**
   * @return The name of the filter file section listing the filters of this kind.
   */
  public String section() {
    return _section;
  }

  public Set<String> recognizedFields() {
    return _recognizedFields;
  }

  public boolean isRecognized(String field) {
    return _recognizedFields.contains(field);
  }
}
