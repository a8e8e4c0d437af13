package com.hrflow.hrflow_backend.controller;

import com.hrflow.hrflow_backend.model.domain.Execution;
import com.hrflow.hrflow_backend.model.domain.ExecutionStep;
import com.hrflow.hrflow_backend.model.domain.Workflow;
import com.hrflow.hrflow_backend.repository.WorkflowRepository;
import com.hrflow.hrflow_backend.service.ExecutionQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionQueryService queryService;
    private final WorkflowRepository workflowRepository;

    // GET /api/executions?status=&workflowId=: newest first
    @GetMapping
    public List<ExecutionSummary> list(@RequestParam(required = false) String status,
                                       @RequestParam(required = false) Long workflowId) {
        List<Execution> executions = queryService.list(status, workflowId);

        List<Long> workflowIds = executions.stream().map(Execution::getWorkflowId).distinct().toList();
        Map<Long, String> names = workflowRepository.findAllById(workflowIds).stream()
                .collect(Collectors.toMap(Workflow::getId, Workflow::getName));

        return executions.stream()
                .map(e -> toSummary(e, names::get))
                .toList();
    }

    // GET /api/executions/{id}: includes the run context
    @GetMapping("/{id}")
    public ResponseEntity<ExecutionDetail> getById(@PathVariable Long id) {
        return queryService.get(id)
                .map(e -> ResponseEntity.ok(toDetail(e)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/steps")
    public ResponseEntity<List<ExecutionStep>> steps(@PathVariable Long id) {
        if (queryService.get(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(queryService.steps(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ExecutionSummary> delete(@PathVariable Long id) {
        return queryService.delete(id)
                .map(e -> ResponseEntity.ok(toSummary(e, this::workflowName)))
                .orElse(ResponseEntity.notFound().build());
    }

    private String workflowName(Long workflowId) {
        return workflowRepository.findById(workflowId).map(Workflow::getName).orElse(null);
    }

    private ExecutionSummary toSummary(Execution e, Function<Long, String> names) {
        String name = names.apply(e.getWorkflowId());
        return new ExecutionSummary(
                e.getId(),
                e.getWorkflowId(),
                name != null ? name : "Unknown",
                e.getTriggerType(),
                e.getStatus().getValue(),
                e.getStartedAt() != null ? e.getStartedAt().toString() : null,
                e.getFinishedAt() != null ? e.getFinishedAt().toString() : null,
                e.getDurationMs(),
                e.getErrorMessage()
        );
    }

    private ExecutionDetail toDetail(Execution e) {
        return new ExecutionDetail(toSummary(e, this::workflowName), e.getRunContext());
    }

    public record ExecutionSummary(
            Long   id,
            Long   workflowId,
            String workflowName,
            String triggerType,
            String status,
            String startedAt,
            String finishedAt,
            Long   durationMs,
            String errorMessage
    ) {}

    public record ExecutionDetail(
            ExecutionSummary    execution,
            Map<String, Object> runContext  // triggering input, engine metadata, CV results
    ) {}
}
