package com.wshg.catalog.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Operation {
    CREATE,
    UPDATE,
    DELETE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Operation fromValue(String value) {
        return Operation.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
