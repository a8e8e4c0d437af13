package com.hrflow.hrflow_backend.service;

import com.hrflow.hrflow_backend.model.domain.AuditLog;
import com.hrflow.hrflow_backend.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fire-and-forget audit trail. A failing write is logged here and never reaches the
 * caller, so auditing can not break the operation being audited.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String EXECUTION_STARTED = "execution_started";
    public static final String EXECUTION_COMPLETED = "execution_completed";
    public static final String EXECUTION_FAILED = "execution_failed";
    public static final String HTTP_DOMAIN_BLOCKED = "http_domain_blocked";
    public static final String ALLOWLIST_DOMAIN_ADDED = "allowlist_domain_added";
    public static final String ALLOWLIST_DOMAIN_REMOVED = "allowlist_domain_removed";

    private final AuditLogRepository auditLogRepository;

    public void record(String eventType, Long actorId, String targetType, Long targetId, Map<String, Object> details) {
        try {
            AuditLog entry = new AuditLog();
            entry.setAction(eventType);
            entry.setActorUserId(actorId);
            entry.setEntityType(targetType);
            entry.setEntityId(targetId);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("details", details != null ? details : Map.of());
            entry.setData(data);
            auditLogRepository.save(entry);
        } catch (Exception e) {
            log.error("Failed to record audit event {} for {} {}: {}", eventType, targetType, targetId, e.getMessage(), e);
        }
    }
}
