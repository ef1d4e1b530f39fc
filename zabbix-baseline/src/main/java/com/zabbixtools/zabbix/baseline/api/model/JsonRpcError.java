/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api.model;

import com.google.gson.annotations.SerializedName;

/**
 * The {@code error} member of a JSON-RPC response.
 */
public class JsonRpcError {
    @SerializedName("code")
    private final int _code;
    @SerializedName("message")
    private final String _message;
    @SerializedName("data")
    private final String _data;

    public JsonRpcError(int code, String message, String data) {
        _code = code;
        _message = message;
        _data = data;
    }

    public int code() {
        return _code;
    }

    public String message() {
        return _message;
    }

    /**
     * @return Detailed description of the error, e.g. "Incorrect user name or password or account is temporarily blocked."
     */
    public String data() {
        return _data;
    }
}
