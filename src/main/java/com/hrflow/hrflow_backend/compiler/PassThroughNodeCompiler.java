package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Inert no-op node. Used for condition nodes, whose branching is expressed purely in the
 * connection map, and for unrecognized kinds so a legacy node never aborts compilation.
 */
@Slf4j
@Component
public class PassThroughNodeCompiler implements NodeCompiler {

    static final String TYPE = "n8n-nodes-base.noOp";

    @Override
    public NodeKind supportedKind() { return NodeKind.UNKNOWN; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        if (node.getNodeKind() == NodeKind.UNKNOWN) {
            log.warn("Node {} has unrecognized kind '{}', compiling as no-op", node.getId(), node.getKind());
        }
        return CompiledNode.builder()
                .id(NodeNames.compiledId(node))
                .name(NodeNames.stableName(node))
                .type(TYPE)
                .typeVersion(1)
                .position(position)
                .parameters(Map.of())
                .build();
    }
}
