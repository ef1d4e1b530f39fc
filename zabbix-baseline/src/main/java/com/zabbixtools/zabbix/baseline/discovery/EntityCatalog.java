/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.discovery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;


/**
 * Entities resolved during discovery, keyed by their Zabbix id. Adding an id twice keeps a single entry holding the
 * latest value. Once {@link #freeze()} is called the catalog is read-only and safe to share between threads.
 *
 * @param <V> The value kept per id, e.g. a display name.
 */
public class EntityCatalog<V> {
  private final String _name;
  private final Map<String, V> _entries;
  private volatile boolean _frozen;

  public EntityCatalog(String name) {
    _name = name;
    _entries = new LinkedHashMap<>();
    _frozen = false;
  }

  /**
   * @param id Entity id.
   * @param value Value to keep for the id.
   * @return {@code true} if the id was not in the catalog yet.
   */
  public synchronized boolean put(String id, V value) {
    ensureNotFrozen();
    return _entries.put(id, value) == null;
  }

  public synchronized V get(String id) {
    return _entries.get(id);
  }

  public synchronized boolean contains(String id) {
    return _entries.containsKey(id);
  }

  /**
   * @return The ids in insertion order. A snapshot while the catalog is open, a view once it is frozen.
   */
  public synchronized Set<String> ids() {
    return _frozen ? Collections.unmodifiableSet(_entries.keySet())
                   : Collections.unmodifiableSet(new LinkedHashSet<>(_entries.keySet()));
  }

  /**
   * @return The entries in insertion order. A snapshot while the catalog is open, a view once it is frozen.
   */
  public synchronized Map<String, V> entries() {
    return _frozen ? Collections.unmodifiableMap(_entries) : Collections.unmodifiableMap(new LinkedHashMap<>(_entries));
  }

  public synchronized int size() {
    return _entries.size();
  }

  public synchronized boolean isEmpty() {
    return _entries.isEmpty();
  }

  /**
   * Make the catalog read-only. Idempotent.
   */
  public synchronized void freeze() {
    _frozen = true;
  }

  public boolean isFrozen() {
    return _frozen;
  }

  public String name() {
    return _name;
  }

  private void ensureNotFrozen() {
    if (_frozen) {
      throw new IllegalStateException("The " + _name + " catalog is frozen, discovery has completed.");
    }
  }

  @Override
  public synchronized String toString() {
    return String.format("%s catalog (%d entries%s)", _name, _entries.size(), _frozen ? ", frozen" : "");
  }
}
