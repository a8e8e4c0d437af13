package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

public record LoggerConfig(String message, String level) implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.LOGGER; }
}
