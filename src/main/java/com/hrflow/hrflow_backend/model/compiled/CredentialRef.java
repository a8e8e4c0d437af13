package com.hrflow.hrflow_backend.model.compiled;

/** Reference to a credential stored inside the automation engine. */
public record CredentialRef(String id, String name) {}
