package com.hrflow.hrflow_backend.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrflow.hrflow_backend.model.config.*;
import com.hrflow.hrflow_backend.model.domain.NodeKind;
import com.hrflow.hrflow_backend.model.domain.WorkflowNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a node's open config map into the typed {@link NodeConfig} for its kind.
 * All defaults and lenient coercions live here so the per-kind compilers only see
 * well-formed values. Never throws on bad author input; wrong types fall back to defaults.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeConfigParser {

    private final ObjectMapper objectMapper;

    public NodeConfig parse(WorkflowNode node) {
        Map<String, Object> cfg = node.getConfig() != null ? node.getConfig() : Map.of();

        return switch (node.getNodeKind()) {
            case TRIGGER -> new TriggerConfig(
                    text(cfg.get("name"), ""),
                    text(cfg.get("email"), ""),
                    text(cfg.get("department"), ""),
                    text(cfg.get("role"), ""),
                    text(cfg.get("startDate"), ""),
                    text(cfg.get("managerEmail"), ""));
            case HTTP -> new HttpConfig(
                    nonBlank(text(cfg.get("url"), ""), HttpConfig.DEFAULT_URL),
                    nonBlank(text(cfg.get("method"), "").trim(), "GET").toUpperCase(Locale.ROOT),
                    parseKeyValueText(cfg.get("headers")),
                    parseKeyValueText(cfg.containsKey("bodyTemplate") ? cfg.get("bodyTemplate") : cfg.get("body")));
            case EMAIL -> new EmailConfig(
                    text(cfg.get("to"), "").trim(),
                    text(cfg.get("cc"), "").trim(),
                    text(cfg.get("bcc"), "").trim());
            case DATABASE -> new DatabaseConfig(text(cfg.get("query"), "").trim());
            case CONDITION -> new ConditionConfig();
            case VARIABLE -> new VariableConfig(
                    nonBlank(text(cfg.get("variableName"), ""), "myVariable"),
                    scalar(cfg.get("value")));
            case DATETIME -> new DateTimeConfig(
                    DateTimeOperation.fromValue(text(cfg.get("operation"), "now")),
                    nonBlank(text(cfg.get("format"), ""), "YYYY-MM-DD"),
                    nonBlank(text(cfg.get("outputField"), ""), "calculatedDate"),
                    amount(cfg.get("value")),
                    nonBlank(text(cfg.get("unit"), ""), "days"));
            case LOGGER -> new LoggerConfig(
                    nonBlank(text(cfg.get("message"), ""), "Log from node " + node.getId()),
                    nonBlank(text(cfg.get("level"), ""), "info"));
            case CV_PARSE -> new CvParseConfig(
                    nonBlank(text(cfg.get("inputType"), ""), "file"),
                    text(cfg.get("cvUrl"), ""),
                    scalar(cfg.get("fileId")));
            case UNKNOWN -> new UnknownConfig(node.getKind());
        };
    }

    /**
     * Parses author-supplied headers or body in either form:
     * <pre>
     * {"Authorization": "Bearer x"}
     *
     * Authorization: Bearer x
     * X-Test: 1
     * </pre>
     * Maps are accepted as-is. Non-string values are JSON-encoded.
     */
    public Map<String, String> parseKeyValueText(Object input) {
        Map<String, String> out = new LinkedHashMap<>();
        if (input == null) return out;

        if (input instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                if (k != null) out.put(k.toString(), stringify(v));
            });
            return out;
        }
        if (!(input instanceof String raw)) return out;

        String text = raw.trim();
        if (text.isEmpty()) return out;

        boolean looksJson = (text.startsWith("{") && text.endsWith("}"))
                || (text.startsWith("[") && text.endsWith("]"));
        if (looksJson) {
            try {
                JsonNode parsed = objectMapper.readTree(text);
                if (parsed != null && parsed.isObject()) {
                    Iterator<Map.Entry<String, JsonNode>> fields = parsed.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        JsonNode value = field.getValue();
                        out.put(field.getKey(), value.isTextual() ? value.asText() : value.toString());
                    }
                    return out;
                }
            } catch (JsonProcessingException e) {
                log.debug("Key/value text is not valid JSON, parsing as lines: {}", e.getOriginalMessage());
            }
        }

        for (String rawLine : text.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) continue;

            int idx = line.indexOf(':');
            if (idx == -1) continue;

            String key = line.substring(0, idx).trim();
            String value = line.substring(idx + 1).trim();
            if (key.isEmpty()) continue;

            out.put(key, value);
        }
        return out;
    }

    private String stringify(Object value) {
        if (value instanceof String s) return s;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String text(Object value, String fallback) {
        return value instanceof String s ? s : fallback;
    }

    private static String nonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    // Numbers and booleans typed into a text field arrive as JSON scalars
    private static String scalar(Object value) {
        if (value instanceof String s) return s;
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        return "";
    }

    private static BigDecimal amount(Object value) {
        if (value instanceof BigDecimal d) return d;
        if (value instanceof Number n) return new BigDecimal(n.toString());
        if (value instanceof String s && !s.isBlank()) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException ignored) {
                return BigDecimal.ZERO;
            }
        }
        return BigDecimal.ZERO;
    }
}
