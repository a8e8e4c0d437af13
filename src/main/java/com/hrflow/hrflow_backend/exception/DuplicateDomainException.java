package com.hrflow.hrflow_backend.exception;

public class DuplicateDomainException extends RuntimeException {

    public DuplicateDomainException(String domain) {
        super("Domain already in allow-list: " + domain);
    }
}
