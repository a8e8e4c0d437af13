package com.hrflow.hrflow_backend.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.compiled.ConnectionMap;

import java.util.List;

/**
 * The external engine that actually runs compiled workflows. Implementations throw
 * {@link com.hrflow.hrflow_backend.exception.EngineException} when the engine is
 * unreachable or answers with an error status.
 */
public interface AutomationEngineClient {

    record UpsertResult(String remoteId, boolean created) {}

    // Creates the definition, or replaces the one already stored under the same name
    UpsertResult upsertDefinition(String name, List<CompiledNode> nodes, ConnectionMap connections);

    void activate(String remoteId);

    JsonNode invokeWebhook(String url, Object body);
}
