package com.hrflow.hrflow_backend.config;

import com.hrflow.hrflow_backend.model.domain.ExecutionStatus;
import com.hrflow.hrflow_backend.model.domain.StepStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Keeps the status check constraints of executions and execution_steps in line with
 * {@link ExecutionStatus} and {@link StepStatus}. Needed when a status value is added
 * after the table was created, e.g. engine_error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionStatusConstraintMigration {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void updateStatusConstraints() {
        replaceConstraint("executions", "executions_status_check",
                Arrays.stream(ExecutionStatus.values()).map(ExecutionStatus::getValue).collect(Collectors.joining("', '")));
        replaceConstraint("execution_steps", "execution_steps_status_check",
                Arrays.stream(StepStatus.values()).map(StepStatus::getValue).collect(Collectors.joining("', '")));
    }

    private void replaceConstraint(String table, String constraint, String allowed) {
        try {
            jdbcTemplate.execute("ALTER TABLE " + table + " DROP CONSTRAINT IF EXISTS " + constraint);
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD CONSTRAINT " + constraint
                    + " CHECK (status IN ('" + allowed + "'))");
            log.debug("Updated {} to allow ('{}')", constraint, allowed);
        } catch (Exception e) {
            log.warn("Could not update {} (constraint may already be correct): {}", constraint, e.getMessage());
        }
    }
}
