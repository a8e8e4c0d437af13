package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;

import java.util.List;

public interface NodeCompiler {

    NodeKind supportedKind();

    // Translates one domain node into its engine node; config is already parsed for this kind
    CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position);
}
