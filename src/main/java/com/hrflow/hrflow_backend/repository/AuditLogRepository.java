package com.hrflow.hrflow_backend.repository;

import com.hrflow.hrflow_backend.model.domain.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {}
