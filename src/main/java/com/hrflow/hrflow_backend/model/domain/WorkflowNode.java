package com.hrflow.hrflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
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
@Table(name = "workflow_nodes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowNode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    // Kept as free text: legacy kinds must load and compile as pass-through nodes
    @Column(nullable = false)
    private String kind;

    private String name;

    // Node-specific parameters; shape depends on kind
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "config_json")
    private Map<String, Object> config;

    // Canvas position, cosmetic only
    @Column(name = "pos_x")
    private Double posX;

    @Column(name = "pos_y")
    private Double posY;

    @Builder.Default
    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @JsonIgnore
    public NodeKind getNodeKind() {
        return NodeKind.fromValue(kind);
    }

    /** Display name, falling back to the raw kind when the author left it blank. */
    @JsonIgnore
    public String getDisplayName() {
        if (name != null && !name.isBlank()) return name;
        return kind != null ? kind : NodeKind.UNKNOWN.getValue();
    }
}
