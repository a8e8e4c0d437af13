package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.config.ConditionConfig;
import com.hrflow.hrflow_backend.model.config.UnknownConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.hrflow.hrflow_backend.support.TestGraphs.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeCompilerRegistryTest {

    @Test
    void get_returnsDedicatedCompiler() {
        NodeCompilerRegistry registry = new NodeCompilerRegistry(List.of(new HttpNodeCompiler(), new PassThroughNodeCompiler()));
        registry.init();

        assertThat(registry.get(NodeKind.HTTP)).isInstanceOf(HttpNodeCompiler.class);
    }

    @Test
    void get_conditionAndUnknownKinds_fallBackToNoOp() {
        NodeCompilerRegistry registry = new NodeCompilerRegistry(List.of(new PassThroughNodeCompiler()));
        registry.init();

        CompiledNode condition = registry.get(NodeKind.CONDITION)
                .compile(node(2, "condition", "Check"), new ConditionConfig(), List.of(450, 200));
        CompiledNode legacy = registry.get(NodeKind.UNKNOWN)
                .compile(node(3, "slack", " "), new UnknownConfig("slack"), List.of(710, 340));

        assertThat(condition.getType()).isEqualTo("n8n-nodes-base.noOp");
        assertThat(condition.getParameters()).isEqualTo(Map.of());
        assertThat(legacy.getName()).isEqualTo("HRFlow 3 slack");
        assertThat(legacy.getTypeVersion()).isEqualTo(1);
    }

    @Test
    void init_withoutPassThroughCompiler_fails() {
        NodeCompilerRegistry registry = new NodeCompilerRegistry(List.of(new HttpNodeCompiler()));

        assertThatThrownBy(registry::init).isInstanceOf(IllegalStateException.class);
    }
}
