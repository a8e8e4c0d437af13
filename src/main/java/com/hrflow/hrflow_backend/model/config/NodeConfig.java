package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

/**
 * Typed view of a node's open config map. One implementation per {@link NodeKind};
 * produced by {@link com.hrflow.hrflow_backend.compiler.NodeConfigParser} before any node is compiled.
 */
public interface NodeConfig {

    NodeKind kind();
}
