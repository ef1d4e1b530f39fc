/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.query;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Parameters of {@code template.get}.
 */
public class TemplateQuery extends FilteredQuery {
    public static final String METHOD = "template.get";
    static final List<String> OUTPUT = Arrays.asList("templateid", "host", "name");

    public TemplateQuery(Map<String, List<String>> filter, Map<String, List<String>> search) {
        super(OUTPUT, filter, search);
    }
}
