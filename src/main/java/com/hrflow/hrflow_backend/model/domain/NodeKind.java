package com.hrflow.hrflow_backend.model.domain;

import java.util.Locale;

public enum NodeKind {
    TRIGGER("trigger"),
    HTTP("http"),
    EMAIL("email"),
    DATABASE("database"),
    CONDITION("condition"),   // branching only; compiled as a no-op shell
    VARIABLE("variable"),
    LOGGER("logger"),
    DATETIME("datetime"),
    CV_PARSE("cv_parse"),

    // Legacy or unrecognized kinds stored in the DB; compiled as inert pass-through nodes
    UNKNOWN("unknown");

    private final String value;

    NodeKind(String value) {
        this.value = value;
    }

    public String getValue() { return value; }

    /** Maps the stored kind column onto the enum. Never throws. */
    public static NodeKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        if ("cv_parser".equals(key)) return CV_PARSE;
        for (NodeKind kind : values()) {
            if (kind.value.equals(key)) return kind;
        }
        return UNKNOWN;
    }
}
