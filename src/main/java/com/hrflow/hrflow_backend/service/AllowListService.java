package com.hrflow.hrflow_backend.service;

import com.hrflow.hrflow_backend.exception.DuplicateDomainException;
import com.hrflow.hrflow_backend.model.domain.AllowedDomain;
import com.hrflow.hrflow_backend.repository.AllowedDomainRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Administration of allow-list rules. Enforcement lives in the compiler's validator. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AllowListService {

    private final AllowedDomainRepository allowedDomainRepository;
    private final AuditService auditService;

    public List<AllowedDomain> list() {
        return allowedDomainRepository.findAllByOrderByCreatedAtDesc();
    }

    public AllowedDomain add(String domain, Long actorId) {
        String normalized = normalize(domain);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Domain must not be blank");
        }
        if (normalized.contains("/") || normalized.contains(":")) {
            throw new IllegalArgumentException("Expected a bare domain such as example.com, got: " + domain);
        }
        if (allowedDomainRepository.existsByDomain(normalized)) {
            throw new DuplicateDomainException(normalized);
        }

        AllowedDomain entry = new AllowedDomain();
        entry.setDomain(normalized);
        entry.setCreatedBy(actorId);
        AllowedDomain saved = allowedDomainRepository.save(entry);
        log.info("Added {} to the allow-list", normalized);

        auditService.record(AuditService.ALLOWLIST_DOMAIN_ADDED, actorId, "allowed_domain", saved.getId(),
                Map.of("domain", normalized));
        return saved;
    }

    /** @return false when no rule with this id exists */
    public boolean remove(Long id, Long actorId) {
        return allowedDomainRepository.findById(id)
                .map(entry -> {
                    allowedDomainRepository.delete(entry);
                    log.info("Removed {} from the allow-list", entry.getDomain());
                    auditService.record(AuditService.ALLOWLIST_DOMAIN_REMOVED, actorId, "allowed_domain", id,
                            Map.of("domain", entry.getDomain()));
                    return true;
                })
                .orElse(false);
    }

    static String normalize(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }
}
