package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

public record UnknownConfig(String rawKind) implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.UNKNOWN; }
}
