/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.query;

import java.util.List;
import java.util.Map;
import com.google.gson.annotations.SerializedName;

/**
 * Parameters shared by the {@code *.get} methods that accept exact and wildcard criteria. Null members are left out
 * of the request; wildcards are only enabled when a search is present.
 */
public abstract class FilteredQuery {
    @SerializedName("output")
    private final List<String> _output;
    @SerializedName("filter")
    private final Map<String, List<String>> _filter;
    @SerializedName("search")
    private final Map<String, List<String>> _search;
    @SerializedName("searchWildcardsEnabled")
    private final Boolean _searchWildcardsEnabled;

    protected FilteredQuery(List<String> output, Map<String, List<String>> filter, Map<String, List<String>> search) {
        _output = output;
        _filter = filter;
        _search = search;
        _searchWildcardsEnabled = search == null ? null : Boolean.TRUE;
    }

    public Map<String, List<String>> filter() {
        return _filter;
    }

    public Map<String, List<String>> search() {
        return _search;
    }
}
