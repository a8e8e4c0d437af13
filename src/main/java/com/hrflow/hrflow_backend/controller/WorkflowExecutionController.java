package com.hrflow.hrflow_backend.controller;

import com.hrflow.hrflow_backend.model.compiled.CompiledDocument;
import com.hrflow.hrflow_backend.model.dto.ExecuteWorkflowRequest;
import com.hrflow.hrflow_backend.model.dto.ExecutionResult;
import com.hrflow.hrflow_backend.service.WorkflowExecutionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowExecutionController {

    private final WorkflowExecutionService executionService;

    // POST /api/workflows/{id}/execute: blocks until the engine run finished
    @PostMapping("/{id}/execute")
    public ResponseEntity<ExecutionResult> execute(@PathVariable Long id,
                                                   @Valid @RequestBody(required = false) ExecuteWorkflowRequest request) {
        String triggerType = request != null ? request.triggerType() : null;
        ExecutionResult result = executionService.executeWorkflow(id, triggerType, request != null ? request.input() : null);
        return ResponseEntity.ok(result);
    }

    // GET /api/workflows/{id}/compiled: the n8n document without running it
    @GetMapping("/{id}/compiled")
    public CompiledDocument compiled(@PathVariable Long id) {
        return executionService.compilePreview(id);
    }
}
