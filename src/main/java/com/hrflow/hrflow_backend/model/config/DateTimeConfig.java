package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

import java.math.BigDecimal;

public record DateTimeConfig(
        DateTimeOperation operation,
        String format,
        String outputField,
        BigDecimal amount,
        String unit
) implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.DATETIME; }
}
