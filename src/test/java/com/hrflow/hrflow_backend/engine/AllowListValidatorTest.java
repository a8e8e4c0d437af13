package com.hrflow.hrflow_backend.engine;

import com.hrflow.hrflow_backend.exception.UrlBlockedException;
import com.hrflow.hrflow_backend.exception.UrlDenial;
import com.hrflow.hrflow_backend.exception.UrlViolation;
import com.hrflow.hrflow_backend.model.domain.AllowedDomain;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import com.hrflow.hrflow_backend.repository.AllowedDomainRepository;
import com.hrflow.hrflow_backend.service.AuditService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.hrflow.hrflow_backend.support.TestGraphs.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AllowListValidatorTest {

    @Mock
    private AllowedDomainRepository allowedDomainRepository;

    @Mock
    private AuditService auditService;

    private AllowListValidator validator;

    @BeforeEach
    void setUp() {
        validator = new AllowListValidator(allowedDomainRepository, auditService);
    }

    @Test
    void validate_openMode_admitsAnyWellFormedUrl() {
        when(allowedDomainRepository.findAll()).thenReturn(List.of());

        assertThat(validator.validate(Set.of("https://anything.example.org/x"))).isEmpty();
    }

    @Test
    void validate_admitsExactHostAndSubdomains() {
        when(allowedDomainRepository.findAll()).thenReturn(domains(" Example.COM "));

        List<UrlDenial> denials = validator.validate(Set.of(
                "https://example.com/a",
                "https://api.example.com/b",
                "https://API.EXAMPLE.COM/c",
                "https://notexample.com/d"));

        assertThat(denials).extracting(UrlDenial::url).containsExactly("https://notexample.com/d");
        assertThat(denials.get(0).reason()).isEqualTo("Domain \"notexample.com\" not in allow-list");
    }

    @Test
    void validate_malformedUrl_isDeniedEvenInOpenMode() {
        when(allowedDomainRepository.findAll()).thenReturn(List.of());

        List<UrlDenial> denials = validator.validate(Set.of("not a url"));

        assertThat(denials).hasSize(1);
        assertThat(denials.get(0).reason()).startsWith("Invalid URL format");
    }

    @Test
    void validate_openMode_admitsExpressionsSpacesAndUnderscoreHosts() {
        when(allowedDomainRepository.findAll()).thenReturn(List.of());

        List<UrlDenial> denials = validator.validate(Set.of(
                "https://api.example.com/users?email={{$json.employee.email}}",
                "https://api.example.com/{{ $json.body.employee.role }}",
                "https://my_service.example.com/hook",
                "https://api.example.com/search?q=a b"));

        assertThat(denials).isEmpty();
    }

    @Test
    void validate_withRules_readsHostOfUrlsCarryingExpressions() {
        when(allowedDomainRepository.findAll()).thenReturn(domains("example.com"));

        List<UrlDenial> denials = validator.validate(Set.of(
                "https://api.example.com/users?email={{$json.employee.email}}",
                "https://my_service.example.com/hook",
                "https://evil.test/{{ $json.body.employee.role }}"));

        assertThat(denials).extracting(UrlDenial::url).containsExactly("https://evil.test/{{ $json.body.employee.role }}");
        assertThat(denials.get(0).reason()).isEqualTo("Domain \"evil.test\" not in allow-list");
    }

    @Test
    void check_urlWithoutScheme_isInvalid() {
        assertThat(AllowListValidator.check("example.com/path", Set.of()))
                .hasValueSatisfying(d -> assertThat(d.reason()).isEqualTo("Invalid URL format: no scheme in example.com/path"));
    }

    @Test
    void check_urlWithoutHost_isInvalid() {
        assertThat(AllowListValidator.check("mailto:hr@example.com", Set.of()))
                .hasValueSatisfying(d -> assertThat(d.reason()).isEqualTo("Invalid URL format: no host in mailto:hr@example.com"));
    }

    @Test
    void validate_noUrls_skipsRepository() {
        assertThat(validator.validate(Set.of())).isEmpty();
        verify(allowedDomainRepository, never()).findAll();
    }

    @Test
    void enforce_blockedUrl_auditsAndThrows() {
        when(allowedDomainRepository.findAll()).thenReturn(domains("example.com"));
        WorkflowNode http = node(5, "http", "Notify", Map.of("url", "https://evil.test/x", "method", "POST"));
        WorkflowNode logger = node(6, "logger", "Log", Map.of("message", "done"));

        UrlBlockedException thrown = catchThrowableOfType(
                () -> validator.enforce(12L, 7L, List.of(http, logger)), UrlBlockedException.class);

        assertThat(thrown)
                .hasMessageStartingWith("Workflow compilation blocked due to non-whitelisted domains:\n")
                .hasMessageContaining("Node \"Notify\" (ID: 5): URL \"https://evil.test/x\" blocked - Domain \"evil.test\" not in allow-list");
        assertThat(thrown.getViolations()).extracting(UrlViolation::nodeId).containsExactly(5L);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(auditService).record(eq(AuditService.HTTP_DOMAIN_BLOCKED), eq(7L), eq("workflow"), eq(12L), details.capture());
        assertThat(details.getValue())
                .containsEntry("nodeId", 5L)
                .containsEntry("nodeName", "Notify")
                .containsEntry("blockedUrl", "https://evil.test/x")
                .containsEntry("reason", "Domain \"evil.test\" not in allow-list");
    }

    @Test
    void enforce_allAdmitted_doesNotAudit() {
        when(allowedDomainRepository.findAll()).thenReturn(domains("example.com"));
        WorkflowNode http = node(5, "http", "Notify", Map.of("url", "https://hooks.example.com/x"));

        validator.enforce(12L, 7L, List.of(http));

        verify(auditService, never()).record(anyString(), any(), anyString(), anyLong(), any());
    }

    @Test
    void findViolations_sameUrlOnTwoNodes_isReportedForBoth() {
        when(allowedDomainRepository.findAll()).thenReturn(domains("example.com"));
        List<WorkflowNode> nodes = List.of(
                node(1, "http", "A", Map.of("url", "https://evil.test")),
                node(2, "variable", "B", Map.of("variableName", "target", "value", "https://evil.test")));

        assertThat(validator.findViolations(nodes))
                .extracting(UrlViolation::nodeId)
                .containsExactly(1L, 2L);
    }

    @Test
    void extractUrls_readsHttpTargetCvUrlAndUrlLikeValues() {
        assertThat(AllowListValidator.extractUrls(node(1, "http", "h", Map.of("url", "internal-service/ping"))))
                .containsExactly("internal-service/ping");
        assertThat(AllowListValidator.extractUrls(node(2, "cv_parse", "cv",
                Map.of("inputType", "url", "cvUrl", "https://cdn.example.com/cv.pdf"))))
                .containsExactly("https://cdn.example.com/cv.pdf");
        assertThat(AllowListValidator.extractUrls(node(3, "cv_parse", "cv",
                Map.of("inputType", "file", "cvUrl", "relative.pdf"))))
                .isEmpty();
        assertThat(AllowListValidator.extractUrls(node(4, "logger", "l", Map.of("message", "see http://x.test"))))
                .isEmpty();
    }

    private static List<AllowedDomain> domains(String... values) {
        return Arrays.stream(values).map(value -> {
            AllowedDomain domain = new AllowedDomain();
            domain.setDomain(value);
            return domain;
        }).toList();
    }
}
