package com.hrflow.hrflow_backend.model.domain;

import com.hrflow.hrflow_backend.model.domain.converter.ExecutionStatusConverter;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "executions")
@Data
public class Execution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    @Column(name = "trigger_type")
    private String triggerType = "manual";

    @Convert(converter = ExecutionStatusConverter.class)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    // Triggering input plus engine interaction metadata; written at creation, amended at completion
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "run_context")
    private Map<String, Object> runContext;

    @Column(name = "started_at")
    private Instant startedAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;
}
