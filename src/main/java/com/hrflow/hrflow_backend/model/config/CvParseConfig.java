package com.hrflow.hrflow_backend.model.config;

import com.hrflow.hrflow_backend.model.domain.NodeKind;

/**
 * inputType is "file" (an uploaded CV referenced by fileId) or "url" (cvUrl, subject to the allow-list).
 */
public record CvParseConfig(String inputType, String cvUrl, String fileId) implements NodeConfig {

    @Override
    public NodeKind kind() { return NodeKind.CV_PARSE; }

    public boolean isUrlInput() {
        return "url".equalsIgnoreCase(inputType);
    }

    public boolean hasFile() {
        return fileId != null && !fileId.isBlank();
    }
}
