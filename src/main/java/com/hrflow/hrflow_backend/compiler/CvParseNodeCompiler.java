package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.Assignment;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Marker only. The CV itself is parsed by the orchestrator before the engine run;
 * this node records in the engine output that parsing happened.
 */
@Component
public class CvParseNodeCompiler implements NodeCompiler {

    @Override
    public NodeKind supportedKind() { return NodeKind.CV_PARSE; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        Long id = node.getId();
        return SetNodes.of(node, position, List.of(
                Assignment.string("cv_type_" + id, "_hrflow.nodeType", "cv_parser"),
                Assignment.string("cv_parsed_" + id, "_hrflow.cvParsed", "true"),
                Assignment.string("cv_ts_" + id, "_hrflow.cvParsedAt", SetNodes.NOW_ISO)));
    }
}
