/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.discovery;

import com.zabbixtools.zabbix.baseline.api.ZabbixQueryCapability;
import com.zabbixtools.zabbix.baseline.api.model.HostElement;
import com.zabbixtools.zabbix.baseline.api.model.ItemElement;
import com.zabbixtools.zabbix.baseline.api.model.TemplateElement;
import com.zabbixtools.zabbix.baseline.config.EntityFilter;
import com.zabbixtools.zabbix.baseline.config.FilterConfiguration;
import com.zabbixtools.zabbix.baseline.config.ItemFilter;
import com.zabbixtools.zabbix.baseline.exception.DiscoveryException;
import com.zabbixtools.zabbix.baseline.exception.ZabbixApiException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.zabbixtools.baseline.common.utils.Utils.validateNotNull;
import static com.zabbixtools.zabbix.baseline.config.constants.DiscoveryConfig.INCLUDE_ALL_HOSTS_CONFIG;


/**
 * Resolves the items to compare in three ordered stages:
 * <ol>
 *   <li>templates matching the template filters,</li>
 *   <li>hosts linked to any resolved template, plus hosts matching the host filters,</li>
 *   <li>items of the resolved hosts matching the item filters.</li>
 * </ol>
 * A failed query is logged and the stage continues with what was resolved so far. If no host is resolved, item
 * discovery only runs when scanning all hosts was explicitly enabled.
 */
public class DiscoveryPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(DiscoveryPipeline.class);
  static final String HOST_ID_FIELD = "hostid";
  private final ZabbixQueryCapability _client;

  public DiscoveryPipeline(ZabbixQueryCapability client) {
    _client = validateNotNull(client, "client cannot be null.");
  }

  /**
   * @param filters The filters to resolve.
   * @param includeAllHosts Whether items are queried on all hosts when no host was resolved.
   * @return The frozen catalogs.
   */
  public DiscoveryResult discover(FilterConfiguration filters, boolean includeAllHosts) throws DiscoveryException {
    EntityCatalog<String> templates = new EntityCatalog<>("template");
    EntityCatalog<String> hosts = new EntityCatalog<>("host");
    EntityCatalog<DiscoveredItem> items = new EntityCatalog<>("item");

    discoverTemplates(filters.templateFilters(), templates);
    templates.freeze();

    discoverHosts(templates, filters.hostFilters(), hosts);
    if (hosts.isEmpty()) {
      if (!includeAllHosts) {
        throw new DiscoveryException(String.format("No host matched the %d template and %d host filters. Fix the filters "
                                                   + "or set %s=true to compare the matching items of all hosts.",
                                                   filters.templateFilters().size(), filters.hostFilters().size(),
                                                   INCLUDE_ALL_HOSTS_CONFIG));
      }
      LOG.warn("No host matched, querying the item filters against all hosts as {} is enabled.", INCLUDE_ALL_HOSTS_CONFIG);
    }

    Map<String, ItemMatch> matches = discoverItems(hosts.isEmpty() ? null : hosts.ids(), filters.itemFilters());
    resolveMissingHosts(matches.values(), hosts);
    hosts.freeze();

    for (ItemMatch match : matches.values()) {
      DiscoveredItem item = toDiscoveredItem(match, hosts);
      if (item != null) {
        items.put(item.itemId(), item);
      }
    }
    items.freeze();

    if (items.isEmpty()) {
      LOG.warn("No item matched the {} item filters, nothing will be compared.", filters.itemFilters().size());
    }
    DiscoveryResult result = new DiscoveryResult(templates, hosts, items);
    LOG.info("Discovery completed: {}.", result);
    return result;
  }

  private void discoverTemplates(List<EntityFilter> templateFilters, EntityCatalog<String> templates) {
    for (EntityFilter templateFilter : templateFilters) {
      List<TemplateElement> matched;
      try {
        matched = _client.queryTemplates(templateFilter.filter(), templateFilter.search());
      } catch (ZabbixApiException e) {
        LOG.error("Failed to query templates for {}.", templateFilter, e);
        continue;
      }
      if (matched.isEmpty()) {
        LOG.info("No template matched {}.", templateFilter);
      }
      for (TemplateElement template : matched) {
        templates.put(template.templateId(), template.displayName());
      }
    }
    LOG.debug("Resolved {}.", templates);
  }

  private void discoverHosts(EntityCatalog<String> templates, List<EntityFilter> hostFilters, EntityCatalog<String> hosts) {
    if (!templates.isEmpty()) {
      try {
        List<HostElement> linked = _client.queryHosts(templates.ids(), null, null);
        if (linked.isEmpty()) {
          LOG.info("No host is linked to the {} resolved templates.", templates.size());
        }
        addHosts(linked, hosts);
      } catch (ZabbixApiException e) {
        LOG.error("Failed to query the hosts linked to templates {}.", templates.ids(), e);
      }
    }
    for (EntityFilter hostFilter : hostFilters) {
      try {
        List<HostElement> matched = _client.queryHosts(null, hostFilter.filter(), hostFilter.search());
        if (matched.isEmpty()) {
          LOG.info("No host matched {}.", hostFilter);
        }
        addHosts(matched, hosts);
      } catch (ZabbixApiException e) {
        LOG.error("Failed to query hosts for {}.", hostFilter, e);
      }
    }
    LOG.debug("Resolved {}.", hosts);
  }

  private static void addHosts(List<HostElement> matched, EntityCatalog<String> hosts) {
    for (HostElement host : matched) {
      hosts.put(host.hostId(), host.displayName());
    }
  }

  /**
   * @param hostIds The hosts to scope the queries to, {@code null} for all hosts.
   * @return Item id to the item and the last filter that matched it.
   */
  private Map<String, ItemMatch> discoverItems(Collection<String> hostIds, List<ItemFilter> itemFilters) {
    Map<String, ItemMatch> matches = new LinkedHashMap<>();
    for (ItemFilter itemFilter : itemFilters) {
      List<ItemElement> matched;
      try {
        matched = _client.queryItems(hostIds, itemFilter.filter(), itemFilter.search());
      } catch (ZabbixApiException e) {
        LOG.error("Failed to query items for {}.", itemFilter, e);
        continue;
      }
      if (matched.isEmpty()) {
        LOG.info("No item matched {}.", itemFilter);
      }
      for (ItemElement item : matched) {
        ItemMatch previous = matches.put(item.itemId(), new ItemMatch(item, itemFilter));
        if (previous != null && !previous._filter.equals(itemFilter)) {
          LOG.debug("Item {} matched several filters, using the settings of {}.", item.itemId(), itemFilter);
        }
      }
    }
    return matches;
  }

  /**
   * Items found without host scoping may belong to hosts that are not in the catalog yet.
   */
  private void resolveMissingHosts(Collection<ItemMatch> matches, EntityCatalog<String> hosts) {
    Set<String> missingHostIds = new LinkedHashSet<>();
    for (ItemMatch match : matches) {
      if (!hosts.contains(match._item.hostId())) {
        missingHostIds.add(match._item.hostId());
      }
    }
    if (missingHostIds.isEmpty()) {
      return;
    }
    try {
      Map<String, List<String>> byHostId = Collections.singletonMap(HOST_ID_FIELD, new ArrayList<>(missingHostIds));
      addHosts(_client.queryHosts(null, byHostId, null), hosts);
    } catch (ZabbixApiException e) {
      LOG.error("Failed to resolve the names of {} hosts.", missingHostIds.size(), e);
    }
  }

  private static DiscoveredItem toDiscoveredItem(ItemMatch match, EntityCatalog<String> hosts) {
    ItemElement item = match._item;
    String hostName = hosts.get(item.hostId());
    if (hostName == null) {
      LOG.warn("Skipping item {} ({}) as its host {} could not be resolved.", item.itemId(), item.key(), item.hostId());
      return null;
    }
    int valueType;
    try {
      valueType = item.valueType();
    } catch (NumberFormatException e) {
      LOG.warn("Skipping item {} ({}) with unexpected value type.", item.itemId(), item.key(), e);
      return null;
    }
    return new DiscoveredItem(item.itemId(), item.hostId(), hostName, item.key(), valueType,
                              match._filter.algorithm(), match._filter.postfix());
  }

  private static final class ItemMatch {
    private final ItemElement _item;
    private final ItemFilter _filter;

    private ItemMatch(ItemElement item, ItemFilter filter) {
      _item = item;
      _filter = filter;
    }
  }
}
