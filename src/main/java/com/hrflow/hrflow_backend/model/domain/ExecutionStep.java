package com.hrflow.hrflow_backend.model.domain;

import com.hrflow.hrflow_backend.model.domain.converter.StepStatusConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * One row per workflow node per execution, written once after the run finished.
 * The engine run is opaque, so status and logs are reconstructed rather than observed.
 */
@Entity
@Table(name = "execution_steps")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStep {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "execution_id", nullable = false)
    private Long executionId;

    @Column(name = "node_id", nullable = false)
    private Long nodeId;

    @Convert(converter = StepStatusConverter.class)
    private StepStatus status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "input_json")
    private Map<String, Object> inputSnapshot;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "output_json")
    private Map<String, Object> outputSnapshot;

    @Column(columnDefinition = "text")
    private String logs;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;
}
