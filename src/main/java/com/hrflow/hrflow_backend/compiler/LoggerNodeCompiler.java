package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.Assignment;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.LoggerConfig;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;

// Tags the item with log metadata and passes it on; never a sink
@Component
public class LoggerNodeCompiler implements NodeCompiler {

    @Override
    public NodeKind supportedKind() { return NodeKind.LOGGER; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        LoggerConfig cfg = (LoggerConfig) config;
        Long id = node.getId();

        return SetNodes.of(node, position, List.of(
                Assignment.string("log_msg_" + id, "_hrflow.log.message", cfg.message()),
                Assignment.string("log_level_" + id, "_hrflow.log.level", cfg.level()),
                Assignment.string("log_ts_" + id, "_hrflow.log.timestamp", SetNodes.NOW_ISO),
                Assignment.string("log_node_" + id, "_hrflow.log.nodeId", String.valueOf(id)),
                Assignment.string("log_type_" + id, "_hrflow.nodeType", "logger")));
    }
}
