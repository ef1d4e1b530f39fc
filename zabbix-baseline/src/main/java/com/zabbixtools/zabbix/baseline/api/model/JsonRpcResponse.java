/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.model;

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

/**
 * The JSON-RPC 2.0 response. Exactly one of {@code result} and {@code error} is expected to be present.
 */
public class JsonRpcResponse {
    @SerializedName("jsonrpc")
    private final String _jsonRpc;
    @SerializedName("result")
    private final JsonElement _result;
    @SerializedName("error")
    private final JsonRpcError _error;
    @SerializedName("id")
    private final Long _id;

    public JsonRpcResponse(JsonElement result, JsonRpcError error, Long id) {
        _jsonRpc = JsonRpcRequest.JSON_RPC_VERSION;
        _result = result;
        _error = error;
        _id = id;
    }

    /**
     * @return The result, {@code null} if the call failed.
     */
    public JsonElement result() {
        return _result;
    }

    /**
     * @return The error, {@code null} if the call succeeded.
     */
    public JsonRpcError error() {
        return _error;
    }

    public Long id() {
        return _id;
    }
}
