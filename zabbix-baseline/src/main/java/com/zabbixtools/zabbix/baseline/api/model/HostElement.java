/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.model;

import java.util.Objects;
import com.google.gson.annotations.SerializedName;

/**
 * A host returned by {@code host.get}.
 */
public class HostElement {
    @SerializedName("hostid")
    private final String _hostId;
    @SerializedName("host")
    private final String _host;
    @SerializedName("name")
    private final String _name;

    public HostElement(String hostId, String host, String name) {
        _hostId = hostId;
        _host = host;
        _name = name;
    }

    public String hostId() {
        return _hostId;
    }

    /**
     * @return Technical name of the host, the one trapper items are addressed with.
     */
    public String host() {
        return _host;
    }

    /**
     * @return Visible name of the host.
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
        HostElement that = (HostElement) o;
        return Objects.equals(_hostId, that._hostId) && Objects.equals(_host, that._host)
               && Objects.equals(_name, that._name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_hostId, _host, _name);
    }
}
