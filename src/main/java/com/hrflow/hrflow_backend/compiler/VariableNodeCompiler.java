package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.Assignment;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.config.VariableConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class VariableNodeCompiler implements NodeCompiler {

    @Override
    public NodeKind supportedKind() { return NodeKind.VARIABLE; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        VariableConfig cfg = (VariableConfig) config;
        return SetNodes.of(node, position, List.of(
                Assignment.string("assignment_" + node.getId(), cfg.variableName(), cfg.value())));
    }
}
