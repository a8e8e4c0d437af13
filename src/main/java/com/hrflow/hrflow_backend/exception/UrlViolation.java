package com.hrflow.hrflow_backend.exception;

/** One blocked URL attributed to the node whose config holds it. */
public record UrlViolation(Long nodeId, String nodeName, String url, String reason) {

    public String describe() {
        return "Node \"" + nodeName + "\" (ID: " + nodeId + "): URL \"" + url + "\" blocked - " + reason;
    }
}
