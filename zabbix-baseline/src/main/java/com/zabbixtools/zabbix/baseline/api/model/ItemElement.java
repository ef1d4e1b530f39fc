/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.model;

import java.util.Objects;
import com.google.gson.annotations.SerializedName;

/**
 * An item returned by {@code item.get}. Zabbix encodes every scalar as a JSON string.
 */
public class ItemElement {
    @SerializedName("itemid")
    private final String _itemId;
    @SerializedName("hostid")
    private final String _hostId;
    @SerializedName("key_")
    private final String _key;
    @SerializedName("value_type")
    private final String _valueType;
    @SerializedName("name")
    private final String _name;

    public ItemElement(String itemId, String hostId, String key, String valueType, String name) {
        _itemId = itemId;
        _hostId = hostId;
        _key = key;
        _valueType = valueType;
        _name = name;
    }

    public String itemId() {
        return _itemId;
    }

    public String hostId() {
        return _hostId;
    }

    public String key() {
        return _key;
    }

    /**
     * @return 0 numeric float, 1 character, 2 log, 3 numeric unsigned, 4 text.
     */
    public int valueType() {
        return Integer.parseInt(_valueType);
    }

    public String name() {
        return _name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ItemElement that = (ItemElement) o;
        return Objects.equals(_itemId, that._itemId) && Objects.equals(_hostId, that._hostId)
               && Objects.equals(_key, that._key) && Objects.equals(_valueType, that._valueType)
               && Objects.equals(_name, that._name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_itemId, _hostId, _key, _valueType, _name);
    }
}
