package com.hrflow.hrflow_backend.engine;

import com.hrflow.hrflow_backend.exception.UrlBlockedException;
import com.hrflow.hrflow_backend.exception.UrlDenial;
import com.hrflow.hrflow_backend.exception.UrlViolation;
import com.hrflow.hrflow_backend.model.domain.AllowedDomain;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import com.hrflow.hrflow_backend.repository.AllowedDomainRepository;
import com.hrflow.hrflow_backend.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Outbound URL policy. With no allow-list rules configured every URL is admitted
 * (open mode). Once a rule exists only its host and its subdomains are admitted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AllowListValidator {

    private final AllowedDomainRepository allowedDomainRepository;
    private final AuditService auditService;

    public Set<String> listDomains() {
        return allowedDomainRepository.findAll().stream()
                .map(AllowedDomain::getDomain)
                .filter(Objects::nonNull)
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Every URL that is not admitted, with the reason. Empty when all pass. */
    public List<UrlDenial> validate(Set<String> urls) {
        if (urls == null || urls.isEmpty()) return List.of();
        Set<String> domains = listDomains();

        List<UrlDenial> denials = new ArrayList<>();
        for (String url : urls) {
            check(url, domains).ifPresent(denials::add);
        }
        return denials;
    }

    /**
     * Validates every URL the nodes reference. Each blocked URL is audited once per node
     * holding it, then the whole compilation is refused.
     */
    public void enforce(Long workflowId, Long actorId, List<WorkflowNode> nodes) {
        List<UrlViolation> violations = findViolations(nodes);
        if (violations.isEmpty()) return;

        for (UrlViolation violation : violations) {
            log.warn("Blocked URL {} on node {} of workflow {}: {}",
                    violation.url(), violation.nodeId(), workflowId, violation.reason());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("nodeId", violation.nodeId());
            details.put("nodeName", violation.nodeName());
            details.put("blockedUrl", violation.url());
            details.put("reason", violation.reason());
            auditService.record(AuditService.HTTP_DOMAIN_BLOCKED, actorId, "workflow", workflowId, details);
        }
        throw new UrlBlockedException(violations);
    }

    public List<UrlViolation> findViolations(List<WorkflowNode> nodes) {
        List<Set<String>> urlsPerNode = new ArrayList<>(nodes.size());
        Set<String> allUrls = new LinkedHashSet<>();
        for (WorkflowNode node : nodes) {
            Set<String> urls = extractUrls(node);
            urlsPerNode.add(urls);
            allUrls.addAll(urls);
        }

        List<UrlViolation> violations = new ArrayList<>();
        for (UrlDenial denial : validate(allUrls)) {
            for (int i = 0; i < nodes.size(); i++) {
                if (!urlsPerNode.get(i).contains(denial.url())) continue;
                WorkflowNode node = nodes.get(i);
                violations.add(new UrlViolation(node.getId(), node.getDisplayName(), denial.url(), denial.reason()));
            }
        }
        return violations;
    }

    /**
     * URLs a node can reach at run time: the http target, the cv_parse source in URL
     * mode, and any other top-level string value that starts with http:// or https://.
     */
    public static Set<String> extractUrls(WorkflowNode node) {
        Set<String> urls = new LinkedHashSet<>();
        Map<String, Object> cfg = node.getConfig() != null ? node.getConfig() : Map.of();
        NodeKind kind = node.getNodeKind();

        if (kind == NodeKind.HTTP && cfg.get("url") instanceof String url) {
            urls.add(url);
        }
        if (kind == NodeKind.CV_PARSE && "url".equals(cfg.get("inputType")) && cfg.get("cvUrl") instanceof String cvUrl) {
            urls.add(cvUrl);
        }
        for (Object value : cfg.values()) {
            if (value instanceof String s && (s.startsWith("http://") || s.startsWith("https://"))) {
                urls.add(s);
            }
        }
        return urls;
    }

    /**
     * Only the scheme and host are read, so n8n {{ ... }} expressions, spaces and
     * underscores elsewhere in the URL do not make it invalid.
     */
    static Optional<UrlDenial> check(String url, Set<String> domains) {
        String host;
        try {
            UriComponents components = UriComponentsBuilder.fromUriString(url.trim()).build();
            if (components.getScheme() == null) {
                return Optional.of(new UrlDenial(url, "Invalid URL format: no scheme in " + url));
            }
            host = components.getHost();
        } catch (IllegalArgumentException e) {
            return Optional.of(new UrlDenial(url, "Invalid URL format: " + e.getMessage()));
        }
        if (host == null || host.isBlank()) {
            return Optional.of(new UrlDenial(url, "Invalid URL format: no host in " + url));
        }
        if (domains.isEmpty()) return Optional.empty();

        String hostname = host.toLowerCase(Locale.ROOT);
        boolean allowed = domains.stream()
                .anyMatch(d -> hostname.equals(d) || hostname.endsWith("." + d));
        return allowed
                ? Optional.empty()
                : Optional.of(new UrlDenial(url, "Domain \"" + hostname + "\" not in allow-list"));
    }
}
