package com.hrflow.hrflow_backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrflow.hrflow_backend.compiler.NodeConfigParser;
import com.hrflow.hrflow_backend.model.config.LoggerConfig;
import com.hrflow.hrflow_backend.model.domain.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Reconstructs the per-node step list after a run. The engine run is one opaque call, so
 * every node gets the same binary status: completed when the run completed, otherwise
 * skipped. Logs are synthetic.
 */
@Component
@RequiredArgsConstructor
public class ExecutionStepBuilder {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final NodeConfigParser configParser;

    public List<ExecutionStep> build(Execution execution,
                                     List<WorkflowNode> nodes,
                                     Map<String, Object> triggerBody,
                                     JsonNode engineResult,
                                     Map<Long, CvParseResult> cvResults) {
        boolean completed = execution.getStatus() == ExecutionStatus.COMPLETED;
        StepStatus status = completed ? StepStatus.COMPLETED : StepStatus.SKIPPED;
        Map<String, Object> engineOutput = finalOutput(engineResult);
        Instant startedAt = execution.getStartedAt();
        Instant finishedAt = execution.getFinishedAt();

        List<ExecutionStep> steps = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            WorkflowNode node = nodes.get(i);
            CvParseResult cvResult = cvResults.get(node.getId());

            Map<String, Object> output = cvResult != null
                    ? cvOutput(cvResult)
                    : (completed ? new LinkedHashMap<>(engineOutput) : new LinkedHashMap<>());

            steps.add(ExecutionStep.builder()
                    .executionId(execution.getId())
                    .nodeId(node.getId())
                    .status(status)
                    .inputSnapshot(new LinkedHashMap<>(i == 0 ? triggerBody : engineOutput))
                    .outputSnapshot(output)
                    .logs(completed ? completedLog(node, i, output, cvResult) : "Skipped - execution did not complete")
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .build());
        }
        return steps;
    }

    /** The last item's json (or the item itself) of the webhook reply; an object reply is used as is. */
    Map<String, Object> finalOutput(JsonNode engineResult) {
        if (engineResult == null) return new LinkedHashMap<>();

        JsonNode candidate = engineResult;
        if (engineResult.isArray()) {
            if (engineResult.isEmpty()) return new LinkedHashMap<>();
            JsonNode last = engineResult.get(engineResult.size() - 1);
            candidate = last.path("json").isObject() ? last.path("json") : last;
        }
        return candidate.isObject()
                ? objectMapper.convertValue(candidate, MAP_TYPE)
                : new LinkedHashMap<>();
    }

    private Map<String, Object> cvOutput(CvParseResult result) {
        Map<String, Object> output = new LinkedHashMap<>(result.data());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("nodeType", "cv_parser");
        meta.put("cvParsed", result.success());
        meta.put("source", result.source());
        meta.put("filename", result.filename());
        meta.put("error", result.error());
        output.put("_hrflow", meta);
        return output;
    }

    private String completedLog(WorkflowNode node, int index, Map<String, Object> output, CvParseResult cvResult) {
        return switch (node.getNodeKind()) {
            case TRIGGER -> {
                Object employee = output.get("employee");
                Object name = employee instanceof Map<?, ?> map ? map.get("name") : null;
                yield "Trigger executed - Employee: " + (name != null ? name : "Unknown");
            }
            case LOGGER -> {
                LoggerConfig cfg = (LoggerConfig) configParser.parse(node);
                yield "[" + cfg.level() + "] " + cfg.message();
            }
            case CV_PARSE -> {
                if (cvResult != null && cvResult.success()) {
                    Object name = output.get("name");
                    int skills = output.get("skills") instanceof Collection<?> c ? c.size() : 0;
                    yield "CV parsed successfully - Candidate: " + (name != null ? name : "Unknown")
                            + ", Skills found: " + skills;
                }
                String error = cvResult != null ? cvResult.error() : null;
                yield "CV parsing failed - " + (error != null ? error : "Unknown error");
            }
            default -> "Executed node " + node.getDisplayName() + " (order " + (index + 1) + ") via n8n";
        };
    }
}
