/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.query;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import com.google.gson.annotations.SerializedName;

/**
 * Parameters of {@code history.get} for one item within an inclusive time range, oldest record first.
 */
public class HistoryQuery {
    public static final String METHOD = "history.get";
    static final String SORT_FIELD = "clock";
    static final String SORT_ORDER = "ASC";
    static final List<String> OUTPUT = Arrays.asList("itemid", "value", "clock", "ns");
    @SerializedName("output")
    private final List<String> _output;
    @SerializedName("history")
    private final int _valueType;
    @SerializedName("itemids")
    private final List<String> _itemIds;
    @SerializedName("time_from")
    private final long _timeFrom;
    @SerializedName("time_till")
    private final long _timeTill;
    @SerializedName("sortfield")
    private final String _sortField;
    @SerializedName("sortorder")
    private final String _sortOrder;

    /**
     * @param itemId Item to read.
     * @param valueType History table to read, the value type of the item.
     * @param timeFrom Range start in seconds since the epoch.
     * @param timeTill Range end in seconds since the epoch.
     */
    public HistoryQuery(String itemId, int valueType, long timeFrom, long timeTill) {
        _output = OUTPUT;
        _valueType = valueType;
        _itemIds = Collections.singletonList(itemId);
        _timeFrom = timeFrom;
        _timeTill = timeTill;
        _sortField = SORT_FIELD;
        _sortOrder = SORT_ORDER;
    }

    public long timeFrom() {
        return _timeFrom;
    }

    public long timeTill() {
        return _timeTill;
    }
}
