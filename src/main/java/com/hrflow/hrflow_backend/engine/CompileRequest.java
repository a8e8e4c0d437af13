package com.hrflow.hrflow_backend.engine;

import com.hrflow.hrflow_backend.model.domain.WorkflowEdge;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;

import java.util.List;

/**
 * @param webhookPath full path such as "/webhook/hrflow-12-execute"
 * @param actorId     user credited in audit events for blocked URLs, may be null
 */
public record CompileRequest(
        Long workflowId,
        String webhookPath,
        List<WorkflowNode> nodes,
        List<WorkflowEdge> edges,
        Long actorId
) {}
