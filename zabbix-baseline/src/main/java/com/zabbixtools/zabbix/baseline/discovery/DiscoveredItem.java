/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.discovery;

import com.zabbixtools.zabbix.baseline.config.AlgorithmConfig;
import java.util.Objects;


/**
 * An item selected for comparison, with its resolved host name and the settings of the item filter that
 * matched it.
 */
public final class DiscoveredItem {
  private final String _itemId;
  private final String _hostId;
  private final String _hostName;
  private final String _key;
  private final int _valueType;
  private final AlgorithmConfig _algorithm;
  private final String _postfix;

  public DiscoveredItem(String itemId,
                        String hostId,
                        String hostName,
                        String key,
                        int valueType,
                        AlgorithmConfig algorithm,
                        String postfix) {
    _itemId = itemId;
    _hostId = hostId;
    _hostName = hostName;
    _key = key;
    _valueType = valueType;
    _algorithm = algorithm;
    _postfix = postfix;
  }

  public String itemId() {
    return _itemId;
  }

  public String hostId() {
    return _hostId;
  }

  /**
   * @return Technical name of the host the item belongs to.
   */
  public String hostName() {
    return _hostName;
  }

  public String key() {
    return _key;
  }

  public int valueType() {
    return _valueType;
  }

  public AlgorithmConfig algorithm() {
    return _algorithm;
  }

  public String postfix() {
    return _postfix;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DiscoveredItem that = (DiscoveredItem) o;
    return _valueType == that._valueType && _itemId.equals(that._itemId) && Objects.equals(_hostId, that._hostId)
           && Objects.equals(_hostName, that._hostName) && Objects.equals(_key, that._key)
           && Objects.equals(_algorithm, that._algorithm) && Objects.equals(_postfix, that._postfix);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_itemId, _hostId, _hostName, _key, _valueType, _algorithm, _postfix);
  }

  @Override
  public String toString() {
    return String.format("item %s (%s) of host %s", _itemId, _key, _hostName);
  }
}
