package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

import java.util.Map;

public record HttpConfig(
        String url,
        String method,
        Map<String, String> headers,
        Map<String, String> body
) implements NodeConfig {

    public static final String DEFAULT_URL = "https://httpbin.org/anything";

    @Override
    public NodeKind kind() { return NodeKind.HTTP; }

    public boolean sendsBody() {
        return !"GET".equals(method);
    }
}
