package com.hrflow.hrflow_backend.model.compiled;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Header or body parameter of an engine HTTP request node. */
@JsonPropertyOrder({"name", "value"})
public record NameValue(String name, String value) {}
