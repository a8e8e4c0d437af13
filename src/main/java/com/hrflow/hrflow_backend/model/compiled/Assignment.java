package com.hrflow.hrflow_backend.model.compiled;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** One field assignment of an engine "set" node. Values starting with "=" are engine expressions. */
@JsonPropertyOrder({"id", "name", "value", "type"})
public record Assignment(String id, String name, String value, String type) {

    public static Assignment string(String id, String name, String value) {
        return new Assignment(id, name, value, "string");
    }
}
