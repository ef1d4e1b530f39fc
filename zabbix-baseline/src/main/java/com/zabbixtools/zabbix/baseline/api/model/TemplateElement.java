/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.model;

import java.util.Objects;
import com.google.gson.annotations.SerializedName;

/**
 * A template returned by {@code template.get}.
 */
public class TemplateElement {
    @SerializedName("templateid")
    private final String _templateId;
    @SerializedName("host")
    private final String _host;
    @SerializedName("name")
    private final String _name;

    public TemplateElement(String templateId, String host, String name) {
        _templateId = templateId;
        _host = host;
        _name = name;
    }

    public String templateId() {
        return _templateId;
    }

    /**
     * @return Technical name of the template.
     */
    public String host() {
        return _host;
    }

    /**
     * @return Visible name of the template.
     */
    public String name() {
        return _name;
    }

    /**
     * @return The technical name, or the visible name if the former is missing.
     */
    public String displayName() {
        return _host != null && !_host.isEmpty() ? _host : _name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TemplateElement that = (TemplateElement) o;
        return Objects.equals(_templateId, that._templateId) && Objects.equals(_host, that._host)
               && Objects.equals(_name, that._name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_templateId, _host, _name);
    }
}
