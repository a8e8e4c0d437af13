package com.hrflow.hrflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "workflows")
@Data
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(name = "is_active")
    private boolean active = true;

    @Column(name = "owner_user_id")
    private Long ownerUserId;

    /** Id of the upserted definition in the automation engine. Set after the first run. */
    @Column(name = "n8n_workflow_id")
    private String remoteWorkflowId;

    @Column(name = "n8n_webhook_path")
    private String remoteWebhookPath;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
