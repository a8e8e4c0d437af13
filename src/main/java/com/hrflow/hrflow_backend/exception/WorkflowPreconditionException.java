package com.hrflow.hrflow_backend.exception;

import lombok.Getter;

/**
 * Raised before an execution record exists: the workflow cannot be run at all.
 */
@Getter
public class WorkflowPreconditionException extends RuntimeException {

    public enum Code {
        WORKFLOW_NOT_FOUND,
        WORKFLOW_INACTIVE,
        WORKFLOW_HAS_NO_NODES
    }

    private final Code code;
    private final Long workflowId;

    public WorkflowPreconditionException(Code code, Long workflowId, String message) {
        super(message);
        this.code = code;
        this.workflowId = workflowId;
    }

    public static WorkflowPreconditionException notFound(Long workflowId) {
        return new WorkflowPreconditionException(Code.WORKFLOW_NOT_FOUND, workflowId,
                "Workflow not found: " + workflowId);
    }

    public static WorkflowPreconditionException inactive(Long workflowId) {
        return new WorkflowPreconditionException(Code.WORKFLOW_INACTIVE, workflowId,
                "Workflow " + workflowId + " is inactive");
    }

    public static WorkflowPreconditionException noNodes(Long workflowId) {
        return new WorkflowPreconditionException(Code.WORKFLOW_HAS_NO_NODES, workflowId,
                "Workflow " + workflowId + " has no nodes to execute");
    }
}
