package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

public record DatabaseConfig(String customQuery) implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.DATABASE; }

    public boolean hasCustomQuery() {
        return customQuery != null && !customQuery.isEmpty();
    }
}
