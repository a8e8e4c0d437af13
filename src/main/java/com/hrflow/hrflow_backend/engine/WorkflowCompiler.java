package com.hrflow.hrflow_backend.engine;

import com.hrflow.hrflow_backend.compiler.NodeCompilerRegistry;
import com.hrflow.hrflow_backend.compiler.NodeConfigParser;
import com.hrflow.hrflow_backend.compiler.NodeNames;
import com.hrflow.hrflow_backend.model.compiled.CompiledDocument;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.compiled.ConnectionMap;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a workflow graph into an n8n document: URL policy first, then one engine
 * node per workflow node behind an injected webhook entry node, then connections.
 * Either the whole document is produced or an exception is thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowCompiler {

    private final AllowListValidator allowListValidator;
    private final NodeConfigParser configParser;
    private final NodeCompilerRegistry compilerRegistry;

    public CompiledDocument compile(CompileRequest request) {
        allowListValidator.enforce(request.workflowId(), request.actorId(), request.nodes());

        List<WorkflowNode> ordered = GraphOrderer.order(request.nodes(), request.edges());

        // Parse every config before compiling any node
        Map<Long, NodeConfig> configs = new LinkedHashMap<>();
        for (WorkflowNode node : ordered) {
            configs.put(node.getId(), configParser.parse(node));
        }

        List<CompiledNode> compiled = new ArrayList<>(ordered.size() + 1);
        compiled.add(webhookNode(request.webhookPath()));
        for (int i = 0; i < ordered.size(); i++) {
            WorkflowNode node = ordered.get(i);
            compiled.add(compilerRegistry.get(node.getNodeKind())
                    .compile(node, configs.get(node.getId()), position(i)));
        }

        ConnectionMap connections = ConnectionBuilder.connect(
                request.nodes(), request.edges(), ordered, NodeNames.WEBHOOK_NODE_NAME);

        log.debug("Compiled workflow {} into {} n8n nodes", request.workflowId(), compiled.size());
        return new CompiledDocument(compiled, connections);
    }

    static List<Integer> position(int index) {
        return List.of(450 + index * 260, 200 + (index % 2) * 140);
    }

    /** "/webhook/hrflow-12-execute" becomes "hrflow-12-execute"; any remaining slashes become dashes. */
    static String internalPath(String webhookPath) {
        return webhookPath
                .replaceFirst("^/webhook/", "")
                .replaceFirst("^/", "")
                .replace("/", "-");
    }

    private static CompiledNode webhookNode(String webhookPath) {
        String path = internalPath(webhookPath);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("httpMethod", "POST");
        parameters.put("path", path);
        parameters.put("responseMode", "lastNode");
        parameters.put("options", Map.of());

        return CompiledNode.builder()
                .id(NodeNames.WEBHOOK_NODE_ID)
                .name(NodeNames.WEBHOOK_NODE_NAME)
                .type("n8n-nodes-base.webhook")
                .typeVersion(1)
                .position(List.of(200, 200))
                // Some n8n versions do not register the production webhook after an API upsert without it
                .webhookId(path)
                .parameters(parameters)
                .build();
    }
}
