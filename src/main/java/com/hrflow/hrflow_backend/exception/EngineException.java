package com.hrflow.hrflow_backend.exception;

import lombok.Getter;

/**
 * The automation engine could not be reached or answered with an error.
 * Executions ending with this exception are classified as engine errors, not failures.
 */
@Getter
public class EngineException extends RuntimeException {

    public enum Code {
        N8N_UNREACHABLE,
        N8N_HTTP_ERROR,
        N8N_MISSING_API_KEY
    }

    private final Code code;

    // Null unless the engine answered
    private final Integer httpStatus;

    public EngineException(Code code, String message) {
        this(code, message, null, null);
    }

    public EngineException(Code code, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = httpStatus;
    }
}
