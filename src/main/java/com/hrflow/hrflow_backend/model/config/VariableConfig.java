package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

public record VariableConfig(String variableName, String value) implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.VARIABLE; }
}
