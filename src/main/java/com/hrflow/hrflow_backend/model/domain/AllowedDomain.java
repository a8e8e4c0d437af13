package com.hrflow.hrflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * One allow-list rule. A rule admits its exact host and every subdomain of it.
 * While the table is empty the allow-list runs in open mode.
 */
@Entity
@Table(name = "allowed_domains")
@Data
public class AllowedDomain {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Stored lower-case, trimmed
    @Column(nullable = false, unique = true)
    private String domain;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
