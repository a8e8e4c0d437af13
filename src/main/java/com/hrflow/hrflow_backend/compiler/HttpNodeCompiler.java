package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.compiled.NameValue;
import com.hrflow.hrflow_backend.model.config.HttpConfig;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class HttpNodeCompiler implements NodeCompiler {

    static final String TYPE = "n8n-nodes-base.httpRequest";

    @Override
    public NodeKind supportedKind() { return NodeKind.HTTP; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        HttpConfig cfg = (HttpConfig) config;

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("method", cfg.method());
        parameters.put("url", cfg.url());
        parameters.put("headerParametersUi", Map.of("parameter", toParameters(cfg.headers())));
        // GET requests carry no body at all, not even an empty one
        if (cfg.sendsBody()) {
            parameters.put("sendBody", true);
            parameters.put("bodyParametersUi", Map.of("parameter", toParameters(cfg.body())));
        }
        parameters.put("options", Map.of());

        return CompiledNode.builder()
                .id(NodeNames.compiledId(node))
                .name(NodeNames.stableName(node))
                .type(TYPE)
                .typeVersion(4)
                .position(position)
                .parameters(parameters)
                .build();
    }

    private static List<NameValue> toParameters(Map<String, String> values) {
        return values.entrySet().stream()
                .map(e -> new NameValue(e.getKey(), e.getValue()))
                .toList();
    }
}
