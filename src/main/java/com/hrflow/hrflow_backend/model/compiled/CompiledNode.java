package com.hrflow.hrflow_backend.model.compiled;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * One node of the document pushed to the automation engine. Field names are the
 * engine's own and must not change.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "type", "typeVersion", "position", "webhookId", "parameters", "credentials"})
public class CompiledNode {
    private String id;
    private String name;
    private String type;
    private Number typeVersion;
    private List<Integer> position;

    // Webhook entry node only
    private String webhookId;

    private Map<String, Object> parameters;

    // Email and database nodes only
    private Map<String, CredentialRef> credentials;
}
