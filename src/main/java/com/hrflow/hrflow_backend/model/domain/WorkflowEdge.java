package com.hrflow.hrflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "workflow_edges")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowEdge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    @Column(name = "from_node_id", nullable = false)
    private Long fromNodeId;

    @Column(name = "to_node_id", nullable = false)
    private Long toNodeId;

    // Lower sorts first when a node fans out
    @Builder.Default
    private Integer priority = 0;

    // Free text; "true"/"false" substrings pick the branch of a condition node
    private String label;

    // Not used by compilation beyond branch detection
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "condition_json")
    private Map<String, Object> condition;

    @Builder.Default
    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    public int priorityOrDefault() {
        return priority != null ? priority : 0;
    }
}
