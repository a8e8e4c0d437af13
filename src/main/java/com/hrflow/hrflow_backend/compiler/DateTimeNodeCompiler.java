package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.Assignment;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.DateTimeConfig;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DateTimeNodeCompiler implements NodeCompiler {

    @Override
    public NodeKind supportedKind() { return NodeKind.DATETIME; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        DateTimeConfig cfg = (DateTimeConfig) config;
        Long id = node.getId();

        return SetNodes.of(node, position, List.of(
                Assignment.string("dt_result_" + id, cfg.outputField(), expression(cfg)),
                Assignment.string("dt_op_" + id, "_hrflow.datetime.operation", cfg.operation().getValue()),
                Assignment.string("dt_type_" + id, "_hrflow.nodeType", "datetime")));
    }

    static String expression(DateTimeConfig cfg) {
        String amount = cfg.amount().stripTrailingZeros().toPlainString();
        return switch (cfg.operation()) {
            case NOW -> SetNodes.NOW_ISO;
            case ADD -> "={{ $now.plus({ " + cfg.unit() + ": " + amount + " }).toISO() }}";
            case SUBTRACT -> "={{ $now.minus({ " + cfg.unit() + ": " + amount + " }).toISO() }}";
            case FORMAT -> "={{ $now.toFormat('" + cfg.format() + "') }}";
        };
    }
}
