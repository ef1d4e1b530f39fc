/*
 * Copyright 2017 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import com.zabbixtools.baseline.common.BaselineConfigurable;
import com.zabbixtools.baseline.common.config.ConfigException;
import com.zabbixtools.zabbix.baseline.ZabbixBaselineUtils;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.zabbixtools.zabbix.baseline.config.constants.DiscoveryConfig.FILTER_CONFIG_FILE_CONFIG;


/**
 * The filter configuration resolver based on files. The format of the file is JSON. Every section is optional.
 * <pre>
 *   {
 *     "templates": [ { "filter": { "host": ["Template OS Linux"] } } ],
 *     "hosts":     [ { "search": { "host": ["web*"] } } ],
 *     "items": [
 *       {
 *         "search": { "key_": ["system.cpu.load*"] },
 *         "algorithm": { "type": "WEEK_OVER_WEEK", "weeks": 3, "window": 3600 },
 *         "postfix": ".wow"
 *       }
 *     ]
 *   }
 * </pre>
 * Only the fields listed by {@link EntityKind#recognizedFields()} may be used in a {@code filter} or {@code search}.
 * {@code window} is the full window width in seconds. Every item filter must name an algorithm.
 */
public class FilterConfigFileResolver implements BaselineConfigurable {
  private static final Logger LOG = LoggerFactory.getLogger(FilterConfigFileResolver.class);
  private static final String FILTER = "filter";
  private static final String SEARCH = "search";
  private static final String ALGORITHM = "algorithm";
  private static final String POSTFIX = "postfix";
  private static final Set<String> TOP_LEVEL_MEMBERS = new HashSet<>(Arrays.asList(EntityKind.TEMPLATE.section(),
                                                                                    EntityKind.HOST.section(),
                                                                                    EntityKind.ITEM.section()));
  private static final Set<String> ENTITY_FILTER_MEMBERS = new HashSet<>(Arrays.asList(FILTER, SEARCH));
  private static final Set<String> ITEM_FILTER_MEMBERS = new HashSet<>(Arrays.asList(FILTER, SEARCH, ALGORITHM, POSTFIX));
  private static final Set<String> ALGORITHM_MEMBERS = new HashSet<>(Arrays.asList("type", "weeks", "window"));
  private String _configFile;
  private FilterConfiguration _filterConfiguration;

  @Override
  public void configure(Map<String, ?> configs) {
    _configFile = ZabbixBaselineUtils.getRequiredConfig(configs, FILTER_CONFIG_FILE_CONFIG);
    _filterConfiguration = loadFilters(_configFile);
    LOG.info("Loaded {} from {}.", _filterConfiguration, _configFile);
  }

  /**
   * @return The filters loaded by {@link #configure(Map)}.
   */
  public FilterConfiguration filterConfiguration() {
    return _filterConfiguration;
  }

  static FilterConfiguration loadFilters(String configFile) {
    JsonElement root;
    try (JsonReader reader = new JsonReader(new InputStreamReader(new FileInputStream(configFile), StandardCharsets.UTF_8))) {
      root = JsonParser.parseReader(reader);
    } catch (IOException e) {
      throw new ConfigException("Unable to read filter file " + configFile, e);
    } catch (JsonParseException e) {
      throw new ConfigException("Malformed JSON in filter file " + configFile, e);
    }
    if (!root.isJsonObject()) {
      throw new ConfigException("Filter file " + configFile + " must contain a JSON object.");
    }
    JsonObject rootObject = root.getAsJsonObject();
    ensureKnownMembers(rootObject, TOP_LEVEL_MEMBERS, "the filter file");

    Gson gson = new Gson();
    RawFilters rawFilters;
    try {
      rawFilters = gson.fromJson(rootObject, RawFilters.class);
    } catch (JsonParseException e) {
      throw new ConfigException("Filter file " + configFile + " does not match the expected structure.", e);
    }

    List<EntityFilter> templateFilters = new ArrayList<>();
    for (JsonObject element : sectionObjects(rootObject, EntityKind.TEMPLATE)) {
      ensureKnownMembers(element, ENTITY_FILTER_MEMBERS, EntityKind.TEMPLATE.section());
    }
    for (RawFilter raw : nonNull(rawFilters.templates)) {
      templateFilters.add(toEntityFilter(EntityKind.TEMPLATE, raw));
    }

    List<EntityFilter> hostFilters = new ArrayList<>();
    for (JsonObject element : sectionObjects(rootObject, EntityKind.HOST)) {
      ensureKnownMembers(element, ENTITY_FILTER_MEMBERS, EntityKind.HOST.section());
    }
    for (RawFilter raw : nonNull(rawFilters.hosts)) {
      hostFilters.add(toEntityFilter(EntityKind.HOST, raw));
    }

    List<ItemFilter> itemFilters = new ArrayList<>();
    for (JsonObject element : sectionObjects(rootObject, EntityKind.ITEM)) {
      ensureKnownMembers(element, ITEM_FILTER_MEMBERS, EntityKind.ITEM.section());
      if (element.has(ALGORITHM) && element.get(ALGORITHM).isJsonObject()) {
        ensureKnownMembers(element.getAsJsonObject(ALGORITHM), ALGORITHM_MEMBERS, ALGORITHM);
      }
    }
    for (RawFilter raw : nonNull(rawFilters.items)) {
      EntityFilter criteria = toEntityFilter(EntityKind.ITEM, raw);
      itemFilters.add(new ItemFilter(criteria.filter(), criteria.search(), toAlgorithmConfig(raw.algorithm), raw.postfix));
    }

    if (itemFilters.isEmpty()) {
      LOG.warn("Filter file {} has no item filter, no item will be compared.", configFile);
    }
    return new FilterConfiguration(templateFilters, hostFilters, itemFilters);
  }

  private static EntityFilter toEntityFilter(EntityKind kind, RawFilter raw) {
    if (raw == null) {
      throw new ConfigException("Null filter in section " + kind.section());
    }
    ensureRecognizedFields(kind, raw.filter, FILTER);
    ensureRecognizedFields(kind, raw.search, SEARCH);
    return new EntityFilter(kind, raw.filter, raw.search);
  }

  private static AlgorithmConfig toAlgorithmConfig(RawAlgorithm raw) {
    if (raw == null) {
      throw new ConfigException("Every item filter requires an " + ALGORITHM + ".");
    }
    if (raw.type == null) {
      throw new ConfigException("Missing algorithm type, expected one of " + Arrays.toString(AlgorithmType.values()));
    }
    AlgorithmType type;
    try {
      type = AlgorithmType.valueOf(raw.type);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("type", raw.type, "Expected one of " + Arrays.toString(AlgorithmType.values()));
    }
    if (raw.weeks == null || raw.window == null) {
      throw new ConfigException(String.format("Algorithm %s requires both weeks and window.", type));
    }
    return new AlgorithmConfig(type, raw.weeks, raw.window);
  }

  private static void ensureRecognizedFields(EntityKind kind, Map<String, List<String>> criteria, String criterion) {
    if (criteria == null) {
      return;
    }
    for (Map.Entry<String, List<String>> entry : criteria.entrySet()) {
      if (!kind.isRecognized(entry.getKey())) {
        throw new ConfigException(String.format("Unknown %s field '%s' in section %s, recognized fields are %s.",
                                                criterion, entry.getKey(), kind.section(), kind.recognizedFields()));
      }
      if (entry.getValue() == null || entry.getValue().isEmpty()) {
        throw new ConfigException(String.format("The %s field '%s' in section %s needs at least one value.",
                                                criterion, entry.getKey(), kind.section()));
      }
    }
  }

  private static void ensureKnownMembers(JsonObject object, Set<String> knownMembers, String location) {
    for (String member : object.keySet()) {
      if (!knownMembers.contains(member)) {
        throw new ConfigException(String.format("Unknown member '%s' in %s, expected one of %s.", member, location, knownMembers));
      }
    }
  }

  private static List<JsonObject> sectionObjects(JsonObject root, EntityKind kind) {
    JsonElement section = root.get(kind.section());
    if (section == null || section.isJsonNull()) {
      return Collections.emptyList();
    }
    if (!section.isJsonArray()) {
      throw new ConfigException("Section " + kind.section() + " must be a JSON array.");
    }
    List<JsonObject> objects = new ArrayList<>();
    for (JsonElement element : section.getAsJsonArray()) {
      if (!element.isJsonObject()) {
        throw new ConfigException("Every entry of section " + kind.section() + " must be a JSON object.");
      }
      objects.add(element.getAsJsonObject());
    }
    return objects;
  }

  private static <T> List<T> nonNull(List<T> list) {
    return list == null ? Collections.emptyList() : list;
  }

  private static class RawFilters {
    private List<RawFilter> templates;
    private List<RawFilter> hosts;
    private List<RawFilter> items;
  }

  private static class RawFilter {
    private Map<String, List<String>> filter;
    private Map<String, List<String>> search;
    private RawAlgorithm algorithm;
    private String postfix;
  }

  private static class RawAlgorithm {
    private String type;
    private Integer weeks;
    private Long window;
  }
}
