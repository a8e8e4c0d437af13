package com.hrflow.hrflow_backend.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Compilation refused because at least one outbound URL is outside the allow-list.
 * The message lists every violation, one per line.
 */
@Getter
public class UrlBlockedException extends RuntimeException {

    private final List<UrlViolation> violations;

    public UrlBlockedException(List<UrlViolation> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    private static String buildMessage(List<UrlViolation> violations) {
        return "Workflow compilation blocked due to non-whitelisted domains:\n"
                + violations.stream().map(UrlViolation::describe).collect(Collectors.joining("\n"));
    }
}
