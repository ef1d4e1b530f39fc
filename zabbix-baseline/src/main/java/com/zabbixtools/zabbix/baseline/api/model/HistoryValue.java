/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.model;

import java.util.Objects;
import com.google.gson.annotations.SerializedName;

/**
 * One history record returned by {@code history.get}. The value stays a string, numeric parsing is up to the
 * consumer.
 */
public class HistoryValue {
    @SerializedName("itemid")
    private final String _itemId;
    @SerializedName("value")
    private final String _value;
    @SerializedName("clock")
    private final String _clock;
    @SerializedName("ns")
    private final String _ns;

    public HistoryValue(String itemId, String value, long clock, long ns) {
        this(itemId, value, String.valueOf(clock), String.valueOf(ns));
    }

    HistoryValue(String itemId, String value, String clock, String ns) {
        _itemId = itemId;
        _value = value;
        _clock = clock;
        _ns = ns;
    }

    public String itemId() {
        return _itemId;
    }

    public String value() {
        return _value;
    }

    /**
     * @return Time of the record in seconds since the epoch.
     */
    public long clock() {
        return Long.parseLong(_clock);
    }

    /**
     * @return Nanoseconds part of the record time, 0 if not reported.
     */
    public long ns() {
        return _ns == null ? 0L : Long.parseLong(_ns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        HistoryValue that = (HistoryValue) o;
        return Objects.equals(_itemId, that._itemId) && Objects.equals(_value, that._value)
               && Objects.equals(_clock, that._clock) && Objects.equals(_ns, that._ns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_itemId, _value, _clock, _ns);
    }

    @Override
    public String toString() {
        return String.format("HistoryValue{itemid=%s, value=%s, clock=%s, ns=%s}", _itemId, _value, _clock, _ns);
    }
}
