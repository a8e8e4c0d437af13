package com.hrflow.hrflow_backend.model.config;

import java.util.Locale;

public enum DateTimeOperation {
    NOW("now"),
    ADD("add"),
    SUBTRACT("subtract"),
    FORMAT("format");

    private final String value;

    DateTimeOperation(String value) {
        this.value = value;
    }

    public String getValue() { return value; }

    // Unrecognized operations fall back to "now"
    public static DateTimeOperation fromValue(String raw) {
        if (raw == null) return NOW;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (DateTimeOperation op : values()) {
            if (op.value.equals(key)) return op;
        }
        return NOW;
    }
}
