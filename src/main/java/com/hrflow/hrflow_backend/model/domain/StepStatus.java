package com.hrflow.hrflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {
    COMPLETED("completed"),
    SKIPPED("skipped");

    private final String value;

    StepStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }

    public static StepStatus fromValue(String raw) {
        for (StepStatus status : values()) {
            if (status.value.equalsIgnoreCase(raw) || status.name().equalsIgnoreCase(raw)) return status;
        }
        throw new IllegalArgumentException("Unknown step status: " + raw);
    }
}
