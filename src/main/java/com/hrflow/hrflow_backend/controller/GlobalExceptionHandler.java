package com.hrflow.hrflow_backend.controller;

import com.hrflow.hrflow_backend.exception.*;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps exceptions to {"error": message, "code": CODE} bodies. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WorkflowPreconditionException.class)
    public ResponseEntity<Map<String, Object>> handlePrecondition(WorkflowPreconditionException ex) {
        HttpStatus status = switch (ex.getCode()) {
            case WORKFLOW_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case WORKFLOW_INACTIVE -> HttpStatus.CONFLICT;
            case WORKFLOW_HAS_NO_NODES -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return body(status, ex.getCode().name(), ex.getMessage());
    }

    // Only reachable from the dry compile endpoint; real runs record these on the execution
    @ExceptionHandler(UrlBlockedException.class)
    public ResponseEntity<Map<String, Object>> handleUrlBlocked(UrlBlockedException ex) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.UNPROCESSABLE_ENTITY, "URL_BLOCKED", ex.getMessage());
        response.getBody().put("blockedUrls", ex.getViolations());
        return response;
    }

    @ExceptionHandler(CompilationException.class)
    public ResponseEntity<Map<String, Object>> handleCompilation(CompilationException ex) {
        log.error("Workflow compilation misconfigured: {}", ex.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "COMPILATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(DuplicateDomainException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateDomainException ex) {
        return body(HttpStatus.CONFLICT, "DOMAIN_EXISTS", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class,
            HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleValidation(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.error("Unexpected error", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected server error");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
