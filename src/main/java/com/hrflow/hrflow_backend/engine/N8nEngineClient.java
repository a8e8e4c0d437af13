package com.hrflow.hrflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hrflow.hrflow_backend.config.HrflowProperties;
import com.hrflow.hrflow_backend.exception.EngineException;
import com.hrflow.hrflow_backend.model.compiled.CompiledNode;
import com.hrflow.hrflow_backend.model.compiled.ConnectionMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * n8n over its public v1 REST API. Definitions are matched by name, so the same
 * HRFlow workflow always maps onto one n8n workflow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class N8nEngineClient implements AutomationEngineClient {

    static final String API_KEY_HEADER = "X-N8N-API-KEY";
    static final int MAX_ERROR_DETAIL = 4000;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final HrflowProperties properties;

    @Override
    public UpsertResult upsertDefinition(String name, List<CompiledNode> nodes, ConnectionMap connections) {
        // "active" is read-only in the v1 API and must not be sent
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("nodes", nodes);
        body.put("connections", connections);
        body.put("settings", Map.of());

        Optional<String> existingId = findDefinitionIdByName(name);
        if (existingId.isEmpty()) {
            JsonNode created = api(HttpMethod.POST, "/workflows", null, body);
            String id = created.path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("n8n did not return an id for created workflow '" + name + "'");
            }
            log.info("Created n8n workflow {} for '{}'", id, name);
            return new UpsertResult(id, true);
        }

        api(HttpMethod.PUT, "/workflows/" + existingId.get(), null, body);
        log.info("Updated n8n workflow {} for '{}'", existingId.get(), name);
        return new UpsertResult(existingId.get(), false);
    }

    @Override
    public void activate(String remoteId) {
        api(HttpMethod.POST, "/workflows/" + remoteId + "/activate", null, null);
        log.debug("Activated n8n workflow {}", remoteId);
    }

    /**
     * Walks the cursor-paginated workflow list until a workflow with this exact name turns up.
     * Stops when the server hands back a cursor it already returned.
     */
    Optional<String> findDefinitionIdByName(String name) {
        Set<String> seenCursors = new HashSet<>();
        String cursor = null;
        while (true) {
            JsonNode page = api(HttpMethod.GET, "/workflows", cursor, null);
            JsonNode list = page.isArray() ? page : page.path("data");
            if (list.isArray()) {
                for (JsonNode workflow : list) {
                    if (name.equals(workflow.path("name").asText(null))) {
                        return Optional.of(workflow.path("id").asText());
                    }
                }
            }
            String next = page.isObject() ? page.path("nextCursor").asText("") : "";
            if (next.isEmpty()) return Optional.empty();
            if (!seenCursors.add(next)) {
                log.warn("n8n repeated pagination cursor {}, stopping workflow lookup for '{}'", next, name);
                return Optional.empty();
            }
            cursor = next;
        }
    }

    @Override
    public JsonNode invokeWebhook(String url, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> request = new HttpEntity<>(toJson(body != null ? body : Map.of()), headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, request, String.class);
        } catch (ResourceAccessException ex) {
            throw new EngineException(EngineException.Code.N8N_UNREACHABLE,
                    "Failed to reach automation engine (n8n) at " + url + ": " + ex.getMessage(), null, ex);
        } catch (HttpStatusCodeException ex) {
            String details = extractErrorDetails(ex.getResponseBodyAsString());
            throw new EngineException(EngineException.Code.N8N_HTTP_ERROR,
                    "n8n webhook error (" + ex.getStatusCode().value() + " " + ex.getStatusText() + ") on " + url + ": " + details,
                    ex.getStatusCode().value(), ex);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new EngineException(EngineException.Code.N8N_HTTP_ERROR,
                    "n8n webhook error (" + describe(response.getStatusCode()) + ") on " + url + ": "
                            + extractErrorDetails(response.getBody()),
                    response.getStatusCode().value(), null);
        }
        return parseWebhookResponse(response.getBody());
    }

    private JsonNode api(HttpMethod method, String path, String cursor, Object body) {
        if (!properties.getN8n().hasApiKey()) {
            throw new EngineException(EngineException.Code.N8N_MISSING_API_KEY,
                    "Missing n8n API key (hrflow.n8n.api-key)");
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getN8n().apiBaseUrl() + path)
                .queryParamIfPresent("cursor", Optional.ofNullable(cursor))
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(API_KEY_HEADER, properties.getN8n().getApiKey());
        HttpEntity<String> request = new HttpEntity<>(body != null ? toJson(body) : null, headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, method, request, String.class);
        } catch (ResourceAccessException ex) {
            throw new EngineException(EngineException.Code.N8N_UNREACHABLE,
                    "Failed to reach n8n API: " + ex.getMessage(), null, ex);
        } catch (HttpStatusCodeException ex) {
            throw new EngineException(EngineException.Code.N8N_HTTP_ERROR,
                    "n8n API error (" + ex.getStatusCode().value() + " " + ex.getStatusText() + ") on " + path + ": "
                            + ex.getResponseBodyAsString(),
                    ex.getStatusCode().value(), ex);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new EngineException(EngineException.Code.N8N_HTTP_ERROR,
                    "n8n API error (" + describe(response.getStatusCode()) + ") on " + path + ": "
                            + (response.getBody() != null ? response.getBody() : ""),
                    response.getStatusCode().value(), null);
        }
        return readTree(response.getBody());
    }

    private static String describe(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? status.value() + " " + known.getReasonPhrase() : String.valueOf(status.value());
    }

    /**
     * n8n reports errors in several shapes depending on where the run failed. Picks the
     * most specific message and caps its length; stack dumps can be huge.
     */
    String extractErrorDetails(String text) {
        String details = text == null || text.isEmpty() ? "(empty response body)" : text;
        if (text != null && !text.isEmpty()) {
            try {
                JsonNode parsed = objectMapper.readTree(text);
                JsonNode candidate = firstPresent(parsed,
                        parsed.path("message"),
                        parsed.path("error").path("message"),
                        parsed.path("error"),
                        parsed.path("cause").path("message"),
                        parsed.path("cause"),
                        parsed.path("data").path("message"));
                details = candidate.isTextual() ? candidate.asText() : candidate.toString();
            } catch (JsonProcessingException e) {
                // HTML error pages and plain text are kept as they are
                log.debug("n8n error body is not JSON: {}", e.getOriginalMessage());
            }
        }
        if (details.length() > MAX_ERROR_DETAIL) {
            details = details.substring(0, MAX_ERROR_DETAIL) + "...(truncated)";
        }
        return details;
    }

    private static JsonNode firstPresent(JsonNode fallback, JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (!candidate.isMissingNode() && !candidate.isNull()) return candidate;
        }
        return fallback;
    }

    private JsonNode parseWebhookResponse(String text) {
        if (text == null || text.isBlank()) return objectMapper.createArrayNode();
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("n8n webhook answered with non-JSON body, wrapping raw text");
            ArrayNode wrapped = objectMapper.createArrayNode();
            ObjectNode item = wrapped.addObject();
            item.put("status", "unknown");
            item.put("finishedAt", Instant.now().toString());
            item.put("raw", text);
            return wrapped;
        }
    }

    private JsonNode readTree(String text) {
        if (text == null || text.isBlank()) return objectMapper.createObjectNode();
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new EngineException(EngineException.Code.N8N_HTTP_ERROR,
                    "n8n API returned a non-JSON body: " + e.getOriginalMessage(), null, e);
        }
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize request body for n8n", e);
        }
    }
}
