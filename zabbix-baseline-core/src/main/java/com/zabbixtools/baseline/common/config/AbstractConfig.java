/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.zabbixtools.baseline.common.config;

import com.zabbixtools.baseline.common.BaselineConfigurable;
import com.zabbixtools.baseline.common.config.types.Password;
import com.zabbixtools.baseline.common.utils.Utils;
import com.zabbixtools.baseline.exception.BaselineException;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A convenient base class for configurations to extend.
 * <p>
 * This class holds both the original configuration that was provided as well as the parsed values, and keeps
 * track of which keys were read so that misspelled keys can be reported via {@link #logUnused()}.
 */
public class AbstractConfig {

  public static final String NL = System.lineSeparator();

  private final Logger _log = LoggerFactory.getLogger(getClass());

  /* configs for which values have been requested, used to detect unused configs */
  private final Set<String> _used;

  /* the original values passed in by the user */
  private final Map<String, ?> _originals;

  /* the parsed values */
  private final Map<String, Object> _values;

  @SuppressWarnings("unchecked")
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    for (Map.Entry<?, ?> entry : originals.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new ConfigException(entry.getKey().toString(), entry.getValue(), "Key must be a string.");
      }
    }
    _originals = (Map<String, ?>) originals;
    _values = definition.parse(_originals);
    _used = Collections.synchronizedSet(new HashSet<>());
    if (doLog) {
      logAll();
    }
  }

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals) {
    this(definition, originals, true);
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    _used.add(key);
    return _values.get(key);
  }

  public void ignore(String key) {
    _used.add(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Long getLong(String key) {
    return (Long) get(key);
  }

  public Boolean getBoolean(String key) {
    return (Boolean) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  public Password getPassword(String key) {
    return (Password) get(key);
  }

  public Class<?> getClass(String key) {
    return (Class<?>) get(key);
  }

  /**
   * @return Supplied keys that were never read.
   */
  public Set<String> unused() {
    Set<String> keys = new HashSet<>(_originals.keySet());
    keys.removeAll(_used);
    return keys;
  }

  /**
   * @return Original configs.
   */
  public Map<String, Object> originals() {
    Map<String, Object> copy = new RecordingMap<>();
    copy.putAll(_originals);
    return copy;
  }

  public Map<String, ?> values() {
    return new RecordingMap<>(_values);
  }

  private void logAll() {
    StringBuilder b = new StringBuilder();
    b.append(getClass().getSimpleName());
    b.append(" values: ");
    b.append(NL);

    // Password#toString() keeps the API secret out of the log.
    for (Map.Entry<String, Object> entry : new TreeMap<>(_values).entrySet()) {
      b.append('\t');
      b.append(entry.getKey());
      b.append(" = ");
      b.append(entry.getValue());
      b.append(NL);
    }
    _log.info(b.toString());
  }

  /**
   * Log warnings for any unused configurations
   */
  public void logUnused() {
    for (String key : unused()) {
      _log.warn("The configuration '{}' was supplied but isn't a known config.", key);
    }
  }

  /**
   * Get a configured instance of the give class specified by the given configuration key. If the object implements
   * {@link BaselineConfigurable} configure it using the configuration.
   *
   * @param key The configuration key for the class
   * @param t The interface the class should implement
   * @param configOverrides Entries added on top of the original configs before configuring the instance.
   * @param <T> The type of the configured instance to be returned.
   * @return A configured instance of the class
   */
  public <T> T getConfiguredInstance(String key, Class<T> t, Map<String, Object> configOverrides)
      throws BaselineException {
    Class<?> c = getClass(key);
    if (c == null) {
      return null;
    }
    Object o = Utils.newInstance(c);
    if (!t.isInstance(o)) {
      throw new BaselineException(c.getName() + " is not an instance of " + t.getName());
    }
    if (o instanceof BaselineConfigurable) {
      Map<String, Object> configPairs = originals();
      configPairs.putAll(configOverrides);
      ((BaselineConfigurable) o).configure(configPairs);
    }
    return t.cast(o);
  }

  public <T> T getConfiguredInstance(String key, Class<T> t) throws BaselineException {
    return getConfiguredInstance(key, t, Collections.emptyMap());
  }

  /**
   * Marks keys retrieved via `get` as used, so that keys consumed by a {@link BaselineConfigurable} are not
   * reported by {@link #logUnused()}.
   */
  private class RecordingMap<V> extends HashMap<String, V> {

    RecordingMap() {
      super();
    }

    RecordingMap(Map<String, ? extends V> m) {
      super(m);
    }

    @Override
    public V get(Object key) {
      if (key instanceof String) {
        ignore((String) key);
      }
      return super.get(key);
    }
  }
}
