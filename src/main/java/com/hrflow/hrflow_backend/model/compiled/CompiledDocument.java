package com.hrflow.hrflow_backend.model.compiled;

import java.util.List;

/**
 * Output of the workflow compiler: the webhook entry node first, then one node per
 * workflow node in visiting order, plus the connection map between them.
 */
public record CompiledDocument(List<CompiledNode> nodes, ConnectionMap connections) {

    public CompiledNode entryNode() {
        return nodes.get(0);
    }
}
