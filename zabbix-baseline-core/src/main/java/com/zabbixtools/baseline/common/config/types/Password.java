/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.zabbixtools.baseline.common.config.types;

/**
 * Wraps the Zabbix API password so that it never shows up in the logged configuration.
 */
public class Password {

    public static final String HIDDEN = "[hidden]";

    private final String _value;

    public Password(String value) {
        _value = value;
    }

    @Override
    public int hashCode() {
        return _value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Password)) {
            return false;
        }
        return _value.equals(((Password) obj)._value);
    }

    /**
     * @return {@link #HIDDEN}, never the secret itself.
     */
    @Override
    public String toString() {
        return HIDDEN;
    }

    /**
     * @return The clear text password.
     */
    public String value() {
        return _value;
    }
}
