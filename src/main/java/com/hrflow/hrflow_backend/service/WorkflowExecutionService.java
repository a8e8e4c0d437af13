package com.hrflow.hrflow_backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrflow.hrflow_backend.compiler.NodeConfigParser;
import com.hrflow.hrflow_backend.config.HrflowProperties;
import com.hrflow.hrflow_backend.engine.AutomationEngineClient;
import com.hrflow.hrflow_backend.engine.AutomationEngineClient.UpsertResult;
import com.hrflow.hrflow_backend.engine.CompileRequest;
import com.hrflow.hrflow_backend.engine.TriggerBodyNormalizer;
import com.hrflow.hrflow_backend.engine.WorkflowCompiler;
import com.hrflow.hrflow_backend.exception.EngineException;
import com.hrflow.hrflow_backend.exception.UrlBlockedException;
import com.hrflow.hrflow_backend.exception.WorkflowPreconditionException;
import com.hrflow.hrflow_backend.model.compiled.CompiledDocument;
import com.hrflow.hrflow_backend.model.config.CvParseConfig;
import com.hrflow.hrflow_backend.model.domain.*;
import com.hrflow.hrflow_backend.model.dto.ExecutionResult;
import com.hrflow.hrflow_backend.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a workflow exactly once through the automation engine.
 *
 * <p>Sequence: preconditions, CV pre-parsing, execution record (running), compile,
 * upsert + activate + webhook call, terminal status, steps. Everything happens on the
 * calling thread; the request blocks until the engine answers or fails.
 *
 * <p>Concurrent runs of the same workflow are not serialized. Both upsert the same
 * remote definition and the last writer wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowExecutionService {

    static final String DEFAULT_TRIGGER_TYPE = "manual";

    private final WorkflowRepository workflowRepository;
    private final WorkflowNodeRepository nodeRepository;
    private final WorkflowEdgeRepository edgeRepository;
    private final ExecutionRepository executionRepository;
    private final ExecutionStepRepository stepRepository;
    private final WorkflowCompiler compiler;
    private final AutomationEngineClient engineClient;
    private final CvParserClient cvParserClient;
    private final NodeConfigParser configParser;
    private final ExecutionStepBuilder stepBuilder;
    private final AuditService auditService;
    private final HrflowProperties properties;
    private final ObjectMapper objectMapper;

    public ExecutionResult executeWorkflow(Long workflowId, String triggerType, Map<String, Object> input) {
        Workflow workflow = workflowRepository.findById(workflowId)
                .orElseThrow(() -> WorkflowPreconditionException.notFound(workflowId));
        if (!workflow.isActive()) {
            throw WorkflowPreconditionException.inactive(workflowId);
        }
        List<WorkflowNode> nodes = nodeRepository.findByWorkflowIdOrderByIdAsc(workflowId);
        if (nodes.isEmpty()) {
            throw WorkflowPreconditionException.noNodes(workflowId);
        }
        List<WorkflowEdge> edges = edgeRepository.findByWorkflowIdOrderByIdAsc(workflowId);

        Map<Long, CvParseResult> cvResults = preParseCvNodes(nodes);

        String resolvedTrigger = triggerType != null && !triggerType.isBlank() ? triggerType.trim() : DEFAULT_TRIGGER_TYPE;
        Map<String, Object> engineMeta = new LinkedHashMap<>();
        engineMeta.put("n8n", null);
        engineMeta.put("n8nWorkflowId", null);
        engineMeta.put("n8nCreated", null);
        engineMeta.put("webhookPath", null);
        engineMeta.put("webhookUrl", null);
        Map<String, Object> runContext = new LinkedHashMap<>();
        runContext.put("input", input);
        runContext.put("engine", engineMeta);

        Execution execution = new Execution();
        execution.setWorkflowId(workflowId);
        execution.setTriggerType(resolvedTrigger);
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setStartedAt(Instant.now());
        execution.setRunContext(runContext);
        execution = executionRepository.save(execution);
        log.info("Execution {} started for workflow {} ({})", execution.getId(), workflowId, resolvedTrigger);

        auditService.record(AuditService.EXECUTION_STARTED, workflow.getOwnerUserId(), "execution", execution.getId(),
                details(workflow, "triggerType", resolvedTrigger));

        String webhookPath = webhookPath(workflowId);
        String webhookUrl = properties.getN8n().resolvedWebhookBaseUrl() + webhookPath;
        Map<String, Object> triggerBody = TriggerBodyNormalizer.normalize(input, triggerConfig(nodes));

        JsonNode engineResult = null;
        ExecutionStatus finalStatus;
        String errorMessage = null;
        try {
            CompiledDocument document = compiler.compile(
                    new CompileRequest(workflowId, webhookPath, nodes, edges, workflow.getOwnerUserId()));

            UpsertResult upsert = engineClient.upsertDefinition(remoteName(workflow), document.nodes(), document.connections());
            engineMeta.put("n8nWorkflowId", upsert.remoteId());
            engineMeta.put("n8nCreated", upsert.created());
            engineMeta.put("webhookPath", webhookPath);
            engineMeta.put("webhookUrl", webhookUrl);

            workflow.setRemoteWorkflowId(upsert.remoteId());
            workflow.setRemoteWebhookPath(webhookPath);
            workflowRepository.save(workflow);

            engineClient.activate(upsert.remoteId());
            engineResult = engineClient.invokeWebhook(webhookUrl, triggerBody);
            finalStatus = ExecutionStatus.COMPLETED;
        } catch (UrlBlockedException ex) {
            finalStatus = ExecutionStatus.FAILED;
            errorMessage = ex.getMessage();
            engineMeta.put("blockedUrls", ex.getViolations());
            log.warn("Execution {} blocked by allow-list: {} violation(s)", execution.getId(), ex.getViolations().size());
        } catch (EngineException ex) {
            finalStatus = ExecutionStatus.ENGINE_ERROR;
            errorMessage = ex.getMessage();
            log.error("Execution {} of workflow {} hit an engine error [{}]: {}",
                    execution.getId(), workflowId, ex.getCode(), ex.getMessage(), ex);
        } catch (Exception ex) {
            finalStatus = ExecutionStatus.FAILED;
            errorMessage = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Execution {} of workflow {} failed: {}", execution.getId(), workflowId, errorMessage, ex);
        }

        Instant finishedAt = Instant.now();
        engineMeta.put("n8n", engineResult != null ? objectMapper.convertValue(engineResult, Object.class) : null);
        if (!cvResults.isEmpty()) {
            Map<String, Object> cvByNode = new LinkedHashMap<>();
            cvResults.forEach((nodeId, result) -> cvByNode.put(String.valueOf(nodeId), result));
            runContext.put("cvParserResults", cvByNode);
        }

        execution.setStatus(finalStatus);
        execution.setErrorMessage(errorMessage);
        execution.setFinishedAt(finishedAt);
        execution.setDurationMs(Duration.between(execution.getStartedAt(), finishedAt).toMillis());
        execution.setRunContext(runContext);
        execution = executionRepository.save(execution);
        log.info("Execution {} finished with status {} in {} ms",
                execution.getId(), finalStatus.getValue(), execution.getDurationMs());

        Map<String, Object> completion = details(workflow, "status", finalStatus.getValue());
        completion.put("durationMs", execution.getDurationMs());
        completion.put("triggerType", resolvedTrigger);
        auditService.record(finalStatus == ExecutionStatus.COMPLETED
                        ? AuditService.EXECUTION_COMPLETED
                        : AuditService.EXECUTION_FAILED,
                workflow.getOwnerUserId(), "execution", execution.getId(), completion);

        List<ExecutionStep> steps = stepRepository.saveAll(
                stepBuilder.build(execution, nodes, triggerBody, engineResult, cvResults));

        return new ExecutionResult(execution, steps, engineMeta.get("n8n"));
    }

    /** Compiles without running anything. The allow-list still applies. */
    public CompiledDocument compilePreview(Long workflowId) {
        Workflow workflow = workflowRepository.findById(workflowId)
                .orElseThrow(() -> WorkflowPreconditionException.notFound(workflowId));
        List<WorkflowNode> nodes = nodeRepository.findByWorkflowIdOrderByIdAsc(workflowId);
        if (nodes.isEmpty()) {
            throw WorkflowPreconditionException.noNodes(workflowId);
        }
        List<WorkflowEdge> edges = edgeRepository.findByWorkflowIdOrderByIdAsc(workflowId);
        return compiler.compile(new CompileRequest(workflowId, webhookPath(workflowId), nodes, edges, workflow.getOwnerUserId()));
    }

    public static String webhookPath(Long workflowId) {
        return "/webhook/hrflow-" + workflowId + "-execute";
    }

    static String remoteName(Workflow workflow) {
        return "HRFlow: " + workflow.getName() + " (#" + workflow.getId() + ")";
    }

    // CV text extraction happens here, outside the engine; the compiled node is only a marker
    private Map<Long, CvParseResult> preParseCvNodes(List<WorkflowNode> nodes) {
        Map<Long, CvParseResult> results = new LinkedHashMap<>();
        for (WorkflowNode node : nodes) {
            if (node.getNodeKind() != NodeKind.CV_PARSE) continue;

            CvParseConfig cfg = (CvParseConfig) configParser.parse(node);
            if (!cfg.hasFile()) {
                log.warn("No fileId on cv_parse node {}", node.getId());
                results.put(node.getId(), CvParseResult.failure(null, "No file uploaded for CV parser"));
                continue;
            }
            CvParseResult result = cvParserClient.parse(cfg.fileId());
            log.info("CV parse for node {}: success={}", node.getId(), result.success());
            results.put(node.getId(), result);
        }
        return results;
    }

    private static Map<String, Object> triggerConfig(List<WorkflowNode> nodes) {
        return nodes.stream()
                .filter(n -> n.getNodeKind() == NodeKind.TRIGGER)
                .findFirst()
                .map(n -> n.getConfig() != null ? n.getConfig() : Map.<String, Object>of())
                .orElse(null);
    }

    private static Map<String, Object> details(Workflow workflow, String key, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("workflowId", workflow.getId());
        details.put("workflowName", workflow.getName());
        details.put(key, value);
        return details;
    }
}
