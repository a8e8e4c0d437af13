package com.hrflow.hrflow_backend.exception;

public record UrlDenial(String url, String reason) {}
