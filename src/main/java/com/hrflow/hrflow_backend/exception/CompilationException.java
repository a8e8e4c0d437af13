package com.hrflow.hrflow_backend.exception;

/** Deployment-level misconfiguration found while compiling, e.g. a missing n8n credential. */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }
}
