package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.domain.WorkflowNode;

/**
 * Naming rules shared by the node compilers and the connection builder. Connections
 * reference nodes by name, so both sides must derive it the same way.
 */
public final class NodeNames {

    public static final String WEBHOOK_NODE_ID = "hrflow_webhook";
    public static final String WEBHOOK_NODE_NAME = "HRFlow Webhook Trigger";

    private NodeNames() {}

    /** "HRFlow &lt;id&gt; &lt;name or kind&gt;" with whitespace collapsed. Stable while id and name are. */
    public static String stableName(WorkflowNode node) {
        return normalize("HRFlow " + node.getId() + " " + node.getDisplayName());
    }

    public static String compiledId(WorkflowNode node) {
        return "hrflow_node_" + node.getId();
    }

    static String normalize(String raw) {
        return raw.replaceAll("\\s+", " ").trim();
    }
}
