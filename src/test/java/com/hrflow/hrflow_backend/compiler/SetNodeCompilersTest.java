package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.Assignment;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.hrflow.hrflow_backend.support.TestGraphs.node;
import static org.assertj.core.api.Assertions.assertThat;

class SetNodeCompilersTest {

    @Test
    void trigger_staticValuesWinOverWebhookBody() {
        CompiledNode compiled = new TriggerNodeCompiler().compile(node(1, "trigger", "Start"),
                new TriggerConfig("Ada", "", "", "", "", ""), List.of(450, 200));

        List<Assignment> assignments = assignments(compiled);
        assertThat(assignments).hasSize(8);
        assertThat(assignments.get(0)).isEqualTo(Assignment.string("trigger_name_1", "employee.name", "Ada"));
        assertThat(assignments.get(1).value())
                .isEqualTo("={{ $json.body?.employee?.email || $json.employee?.email || '' }}");
        assertThat(assignments).extracting(Assignment::name)
                .contains("employee.managerEmail", "_hrflow.triggeredAt", "_hrflow.nodeType");
    }

    @Test
    void setNodes_keepIncomingFields() {
        CompiledNode compiled = new VariableNodeCompiler().compile(node(6, "variable", "Flag"),
                new VariableConfig("approved", "yes"), List.of(450, 200));

        assertThat(compiled.getType()).isEqualTo("n8n-nodes-base.set");
        assertThat(compiled.getTypeVersion()).isEqualTo(3.4);
        assertThat(compiled.getParameters())
                .containsEntry("mode", "manual")
                .containsEntry("duplicateItem", false)
                .containsEntry("includeOtherFields", true);
        assertThat(assignments(compiled)).containsExactly(Assignment.string("assignment_6", "approved", "yes"));
    }

    @Test
    void datetime_expressions() {
        assertThat(DateTimeNodeCompiler.expression(dt(DateTimeOperation.NOW, "0")))
                .isEqualTo("={{ $now.toISO() }}");
        assertThat(DateTimeNodeCompiler.expression(dt(DateTimeOperation.ADD, "7.0")))
                .isEqualTo("={{ $now.plus({ days: 7 }).toISO() }}");
        assertThat(DateTimeNodeCompiler.expression(dt(DateTimeOperation.SUBTRACT, "1.5")))
                .isEqualTo("={{ $now.minus({ days: 1.5 }).toISO() }}");
        assertThat(DateTimeNodeCompiler.expression(dt(DateTimeOperation.FORMAT, "0")))
                .isEqualTo("={{ $now.toFormat('YYYY-MM-DD') }}");
    }

    @Test
    void datetime_writesIntoConfiguredField() {
        CompiledNode compiled = new DateTimeNodeCompiler().compile(node(8, "datetime", "Due"),
                dt(DateTimeOperation.ADD, "30"), List.of(450, 200));

        assertThat(assignments(compiled)).extracting(Assignment::name)
                .containsExactly("probationEnd", "_hrflow.datetime.operation", "_hrflow.nodeType");
    }

    @Test
    void logger_tagsItemWithLogMetadata() {
        CompiledNode compiled = new LoggerNodeCompiler().compile(node(9, "logger", "Audit"),
                new LoggerConfig("Employee onboarded", "warn"), List.of(450, 200));

        assertThat(assignments(compiled))
                .contains(Assignment.string("log_msg_9", "_hrflow.log.message", "Employee onboarded"))
                .contains(Assignment.string("log_level_9", "_hrflow.log.level", "warn"))
                .contains(Assignment.string("log_node_9", "_hrflow.log.nodeId", "9"));
    }

    @Test
    void cvParse_marksItemAsParsed() {
        CompiledNode compiled = new CvParseNodeCompiler().compile(node(10, "cv_parse", "CV"),
                new CvParseConfig("file", "", "abc"), List.of(450, 200));

        assertThat(assignments(compiled)).extracting(Assignment::name)
                .containsExactly("_hrflow.nodeType", "_hrflow.cvParsed", "_hrflow.cvParsedAt");
    }

    private static DateTimeConfig dt(DateTimeOperation operation, String amount) {
        return new DateTimeConfig(operation, "YYYY-MM-DD", "probationEnd", new BigDecimal(amount), "days");
    }

    @SuppressWarnings("unchecked")
    private static List<Assignment> assignments(CompiledNode compiled) {
        Map<String, Object> holder = (Map<String, Object>) compiled.getParameters().get("assignments");
        return (List<Assignment>) holder.get("assignments");
    }
}
