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
 * Parameters of {@code host.get}. Templates are never returned as hosts.
 */
public class HostQuery extends FilteredQuery {
    public static final String METHOD = "host.get";
    static final List<String> OUTPUT = Arrays.asList("hostid", "host", "name");
    @SerializedName("templateids")
    private final List<String> _templateIds;
    @SerializedName("templated_hosts")
    private final boolean _templatedHosts;

    /**
     * @param templateIds Restrict to hosts linked to one of these templates, {@code null} or empty for no restriction.
     * @param filter Exact criteria, may be {@code null}.
     * @param search Wildcard criteria, may be {@code null}.
     */
    public HostQuery(Collection<String> templateIds, Map<String, List<String>> filter, Map<String, List<String>> search) {
        super(OUTPUT, filter, search);
        _templateIds = templateIds == null || templateIds.isEmpty() ? null : new ArrayList<>(templateIds);
        _templatedHosts = false;
    }

    public List<String> templateIds() {
        return _templateIds;
    }
}
