package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.Assignment;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds engine "set" nodes. Every assignment-style kind (trigger, variable, datetime,
 * logger, cv_parse) compiles to one of these, keeping all other incoming fields.
 */
final class SetNodes {

    static final String TYPE = "n8n-nodes-base.set";
    static final double TYPE_VERSION = 3.4;
    static final String NOW_ISO = "={{ $now.toISO() }}";

    private SetNodes() {}

    static CompiledNode of(WorkflowNode node, List<Integer> position, List<Assignment> assignments) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("mode", "manual");
        parameters.put("duplicateItem", false);
        parameters.put("assignments", Map.of("assignments", List.copyOf(assignments)));
        parameters.put("includeOtherFields", true);
        parameters.put("options", Map.of());

        return CompiledNode.builder()
                .id(NodeNames.compiledId(node))
                .name(NodeNames.stableName(node))
                .type(TYPE)
                .typeVersion(TYPE_VERSION)
                .position(position)
                .parameters(parameters)
                .build();
    }
}
