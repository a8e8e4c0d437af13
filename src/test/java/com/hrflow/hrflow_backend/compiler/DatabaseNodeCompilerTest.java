package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.config.HrflowProperties;
import com.hrflow.hrflow_backend.exception.CompilationException;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.compiled.CredentialRef;
import com.hrflow.hrflow_backend.model.config.DatabaseConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hrflow.hrflow_backend.support.TestGraphs.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseNodeCompilerTest {

    private HrflowProperties properties;
    private DatabaseNodeCompiler compiler;

    @BeforeEach
    void setUp() {
        properties = new HrflowProperties();
        properties.getCredentials().setPostgresId("pg-1");
        properties.getCredentials().setPostgresName("HR Database");
        properties.getEmail().setDefaultRecipient("fallback@example.com");
        compiler = new DatabaseNodeCompiler(properties);
    }

    @Test
    void defaultQuery_upsertsUserAndEmployee() {
        CompiledNode compiled = compiler.compile(node(2, "database", "Onboard"), new DatabaseConfig(""), List.of(0, 0));

        String query = (String) compiled.getParameters().get("query");
        assertThat(compiled.getParameters()).containsEntry("operation", "executeQuery");
        assertThat(compiled.getCredentials()).containsEntry("postgres", new CredentialRef("pg-1", "HR Database"));
        assertThat(compiled.getTypeVersion()).isEqualTo(2.6);
        assertThat(query)
                .contains("INSERT INTO \"Core\".users")
                .contains("ON CONFLICT (email)")
                .contains("INSERT INTO \"Core\".employees")
                .contains("|| \"fallback@example.com\"")
                .doesNotContain("%1$s");
    }

    @Test
    void customQuery_isUsedVerbatim() {
        CompiledNode compiled = compiler.compile(node(2, "database", "Onboard"),
                new DatabaseConfig("SELECT 1"), List.of(0, 0));

        assertThat(compiled.getParameters()).containsEntry("query", "SELECT 1");
    }

    @Test
    void missingPostgresCredential_fails() {
        properties.getCredentials().setPostgresId("");

        assertThatThrownBy(() -> compiler.compile(node(2, "database", "Onboard"), new DatabaseConfig(""), List.of(0, 0)))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Postgres");
    }
}
