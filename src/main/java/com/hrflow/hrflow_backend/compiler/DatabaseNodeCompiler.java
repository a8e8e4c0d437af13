package com.hrflow.hrflow_backend.compiler;

import com.hrflow.hrflow_backend.config.HrflowProperties;
import com.hrflow.hrflow_backend.exception.CompilationException;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.compiled.CredentialRef;
import com.hrflow.hrflow_backend.model.config.DatabaseConfig;
import com.hrflow.hrflow_backend.model.config.NodeConfig;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Onboards the employee into the HR schema. The default statement finds or creates the
 * user by email and then creates the linked employee row if it is missing, all in one
 * statement. A custom query in the node config replaces it verbatim.
 */
@Component
@RequiredArgsConstructor
public class DatabaseNodeCompiler implements NodeCompiler {

    static final String TYPE = "n8n-nodes-base.postgres";

    private static final String DEFAULT_QUERY_TEMPLATE = """
            WITH role_pick AS (
              SELECT id
              FROM "Core".roles
              WHERE lower(name) = 'employee'
              LIMIT 1
            ),
            upsert_user AS (
              INSERT INTO "Core".users (email, password_hash, full_name, role_id, is_active)
              VALUES (
                '={{(
                  ($json.employee && $json.employee.email ? $json.employee.email : $json.email)
                  || "%1$s"
                )}}',
                'TEMP_PASSWORD_HASH',
                '={{(
                  ($json.employee && $json.employee.name ? $json.employee.name : ($json.name || $json.full_name || $json.fullName))
                  || "Demo User"
                )}}',
                COALESCE((SELECT id FROM role_pick), 1),
                true
              )
              ON CONFLICT (email)
              DO UPDATE SET
                full_name = EXCLUDED.full_name,
                is_active = true
              RETURNING id
            ),
            ins_employee AS (
              INSERT INTO "Core".employees (user_id, hire_date, probation_end, is_active)
              SELECT
                upsert_user.id,
                CURRENT_DATE,
                NULL,
                true
              FROM upsert_user
              WHERE NOT EXISTS (
                SELECT 1 FROM "Core".employees e WHERE e.user_id = upsert_user.id
              )
              RETURNING id
            )
            SELECT
              (SELECT id FROM upsert_user) AS user_id,
              (SELECT id FROM ins_employee) AS employee_id,
              '={{(
                  ($json.employee && $json.employee.email ? $json.employee.email : $json.email)
                  || "%1$s"
                )}}' AS email,
              '={{(
                  ($json.employee && $json.employee.name ? $json.employee.name : ($json.name || $json.full_name || $json.fullName))
                  || "Demo User"
                )}}' AS name;""";

    private final HrflowProperties properties;

    @Override
    public NodeKind supportedKind() { return NodeKind.DATABASE; }

    @Override
    public CompiledNode compile(WorkflowNode node, NodeConfig config, List<Integer> position) {
        HrflowProperties.Credentials credentials = properties.getCredentials();
        if (!credentials.hasPostgres()) {
            throw new CompilationException("Missing Postgres credential settings (hrflow.credentials.postgres-id and postgres-name)");
        }
        DatabaseConfig cfg = (DatabaseConfig) config;

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("operation", "executeQuery");
        parameters.put("query", cfg.hasCustomQuery() ? cfg.customQuery() : defaultQuery());
        parameters.put("options", Map.of());

        return CompiledNode.builder()
                .id(NodeNames.compiledId(node))
                .name(NodeNames.stableName(node))
                .type(TYPE)
                .typeVersion(2.6)
                .position(position)
                .parameters(parameters)
                .credentials(Map.of("postgres", new CredentialRef(
                        credentials.getPostgresId().trim(), credentials.getPostgresName().trim())))
                .build();
    }

    String defaultQuery() {
        return DEFAULT_QUERY_TEMPLATE.formatted(properties.getEmail().getDefaultRecipient());
    }
}
