/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.model;

import com.google.gson.annotations.SerializedName;

/**
 * The JSON-RPC 2.0 envelope of a Zabbix API call. {@code auth} is only serialized when set, i.e. for servers that
 * predate bearer token authentication.
 */
public class JsonRpcRequest {
    public static final String JSON_RPC_VERSION = "2.0";
    @SerializedName("jsonrpc")
    private final String _jsonRpc;
    @SerializedName("method")
    private final String _method;
    @SerializedName("params")
    private final Object _params;
    @SerializedName("id")
    private final long _id;
    @SerializedName("auth")
    private final String _auth;

    public JsonRpcRequest(String method, Object params, long id, String auth) {
        _jsonRpc = JSON_RPC_VERSION;
        _method = method;
        _params = params;
        _id = id;
        _auth = auth;
    }

    public String method() {
        return _method;
    }

    public long id() {
        return _id;
    }
}
