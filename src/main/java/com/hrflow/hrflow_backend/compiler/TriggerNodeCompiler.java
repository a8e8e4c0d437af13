package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.Assignment;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.config.TriggerConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Exposes the employee record as flat "employee.*" fields. A value typed into the
 * trigger config wins; otherwise the field is read from the webhook body at run time.
 */
@Component
public class TriggerNodeCompiler implements NodeCompiler {

    @Override
    public NodeKind supportedKind() { return NodeKind.TRIGGER; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        TriggerConfig cfg = (TriggerConfig) config;
        Long id = node.getId();

        return SetNodes.of(node, position, List.of(
                Assignment.string("trigger_name_" + id, "employee.name", staticOrBody(cfg.name(), "name")),
                Assignment.string("trigger_email_" + id, "employee.email", staticOrBody(cfg.email(), "email")),
                Assignment.string("trigger_dept_" + id, "employee.department", staticOrBody(cfg.department(), "department")),
                Assignment.string("trigger_role_" + id, "employee.role", staticOrBody(cfg.role(), "role")),
                Assignment.string("trigger_start_" + id, "employee.startDate", staticOrBody(cfg.startDate(), "startDate")),
                Assignment.string("trigger_manager_" + id, "employee.managerEmail", staticOrBody(cfg.managerEmail(), "managerEmail")),
                Assignment.string("trigger_ts_" + id, "_hrflow.triggeredAt", SetNodes.NOW_ISO),
                Assignment.string("trigger_type_" + id, "_hrflow.nodeType", "trigger")));
    }

    static String staticOrBody(String value, String field) {
        if (value != null && !value.isEmpty()) return value;
        return "={{ $json.body?.employee?." + field + " || $json.employee?." + field + " || '' }}";
    }
}
