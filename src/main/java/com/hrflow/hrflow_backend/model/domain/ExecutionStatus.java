package com.hrflow.hrflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one workflow run. RUNNING is the only non-terminal state; a record moves
 * to exactly one of the other three and never changes again.
 */
public enum ExecutionStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    ENGINE_ERROR("engine_error"),   // automation engine unreachable or answered non-2xx
    FAILED("failed");               // policy violation, bad config, anything else

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }

    public static ExecutionStatus fromValue(String raw) {
        for (ExecutionStatus status : values()) {
            if (status.value.equalsIgnoreCase(raw) || status.name().equalsIgnoreCase(raw)) return status;
        }
        throw new IllegalArgumentException("Unknown execution status: " + raw);
    }
}
