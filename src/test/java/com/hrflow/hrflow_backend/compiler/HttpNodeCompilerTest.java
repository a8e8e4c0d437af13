package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.compiled.NameValue;
import com.hrflow.hrflow_backend.model.config.HttpConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.hrflow.hrflow_backend.support.TestGraphs.node;
import static org.assertj.core.api.Assertions.assertThat;

class HttpNodeCompilerTest {

    private final HttpNodeCompiler compiler = new HttpNodeCompiler();

    @Test
    void get_hasNoBodyParameters() {
        HttpConfig cfg = new HttpConfig("https://api.example.com", "GET", Map.of("X-Test", "1"), Map.of("ignored", "x"));

        CompiledNode compiled = compiler.compile(node(3, "http", "Lookup"), cfg, List.of(450, 200));

        assertThat(compiled.getParameters())
                .containsEntry("method", "GET")
                .containsEntry("url", "https://api.example.com")
                .containsEntry("headerParametersUi", Map.of("parameter", List.of(new NameValue("X-Test", "1"))))
                .doesNotContainKeys("sendBody", "bodyParametersUi");
    }

    @Test
    void post_sendsBodyParameters() {
        HttpConfig cfg = new HttpConfig("https://api.example.com", "POST", Map.of(), Map.of("employee", "Ada"));

        CompiledNode compiled = compiler.compile(node(3, "http", "Notify"), cfg, List.of(450, 200));

        assertThat(compiled.getId()).isEqualTo("hrflow_node_3");
        assertThat(compiled.getName()).isEqualTo("HRFlow 3 Notify");
        assertThat(compiled.getType()).isEqualTo("n8n-nodes-base.httpRequest");
        assertThat(compiled.getTypeVersion()).isEqualTo(4);
        assertThat(compiled.getParameters())
                .containsEntry("sendBody", true)
                .containsEntry("bodyParametersUi", Map.of("parameter", List.of(new NameValue("employee", "Ada"))))
                .containsEntry("headerParametersUi", Map.of("parameter", List.of()));
        assertThat(compiled.getCredentials()).isNull();
    }
}
