/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import com.google.gson.annotations.SerializedName;

/**
 * Parameters of {@code item.get}, sorted by item id for a stable processing order.
 */
public class ItemQuery extends FilteredQuery {
    public static final String METHOD = "item.get";
    static final List<String> OUTPUT = Arrays.asList("itemid", "hostid", "key_", "value_type", "name");
    @SerializedName("hostids")
    private final List<String> _hostIds;
    @SerializedName("sortfield")
    private final String _sortField;

    /**
     * @param hostIds Restrict to items of these hosts, {@code null} to query all hosts.
     * @param filter Exact criteria, may be {@code null}.
     * @param search Wildcard criteria, may be {@code null}.
     */
    public ItemQuery(Collection<String> hostIds, Map<String, List<String>> filter, Map<String, List<String>> search) {
        super(OUTPUT, filter, search);
        _hostIds = hostIds == null ? null : new ArrayList<>(hostIds);
        _sortField = "itemid";
    }

    public List<String> hostIds() {
        return _hostIds;
    }
}
