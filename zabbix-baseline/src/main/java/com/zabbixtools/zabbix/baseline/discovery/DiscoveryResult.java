/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.discovery;

/**
 * The frozen catalogs produced by one discovery run.
 */
public class DiscoveryResult {
  private final EntityCatalog<String> _templates;
  private final EntityCatalog<String> _hosts;
  private final EntityCatalog<DiscoveredItem> _items;

  public DiscoveryResult(EntityCatalog<String> templates, EntityCatalog<String> hosts, EntityCatalog<DiscoveredItem> items) {
    if (!templates.isFrozen() || !hosts.isFrozen() || !items.isFrozen()) {
      throw new IllegalArgumentException("Discovery catalogs must be frozen.");
    }
    _templates = templates;
    _hosts = hosts;
    _items = items;
  }

  /**
   * @return Template id to template name.
   */
  public EntityCatalog<String> templates() {
    return _templates;
  }

  /**
   * @return Host id to host name.
   */
  public EntityCatalog<String> hosts() {
    return _hosts;
  }

  /**
   * @return Item id to item.
   */
  public EntityCatalog<DiscoveredItem> items() {
    return _items;
  }

  @Override
  public String toString() {
    return String.format("DiscoveryResult{%s, %s, %s}", _templates, _hosts, _items);
  }
}
