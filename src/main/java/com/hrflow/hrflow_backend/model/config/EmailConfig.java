package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

public record EmailConfig(String to, String cc, String bcc) implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.EMAIL; }
}
