package com.hrflow.hrflow_backend.model.dto;

import jakarta.validation.constraints.Size;

import java.util.Map;

public record ExecuteWorkflowRequest(
        @Size(max = 50) String triggerType,
        Map<String, Object> input
) {}
