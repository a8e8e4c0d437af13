package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

// Branch semantics live on the outgoing edges, not in the node config
public record ConditionConfig() implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.CONDITION; }
}
