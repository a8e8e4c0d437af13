package com.hrflow.hrflow_backend.model.compiled;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"node", "type", "index"})
public record ConnectionTarget(String node, String type, int index) {

    public static ConnectionTarget main(String node) {
        return new ConnectionTarget(node, "main", 0);
    }
}
