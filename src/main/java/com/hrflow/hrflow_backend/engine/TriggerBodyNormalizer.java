package com.hrflow.hrflow_backend.engine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shapes the webhook body so the compiled trigger always finds {@code employee.*}.
 *
 * <p>The employee record is taken from the first source that has one: the input's
 * {@code employee} object, the input itself when it looks like an employee, the trigger
 * node's {@code employee} object, the trigger node config itself. Its fields are also
 * copied to the top level, and the raw input keys are merged last.
 */
public final class TriggerBodyNormalizer {

    private TriggerBodyNormalizer() {}

    public static Map<String, Object> normalize(Object input, Map<String, Object> triggerConfig) {
        Map<String, Object> obj = asObject(input);
        Map<String, Object> employee = null;

        if (obj != null && asObject(obj.get("employee")) != null) {
            employee = asObject(obj.get("employee"));
        } else if (obj != null && looksLikeEmployee(obj)) {
            employee = obj;
        } else if (triggerConfig != null) {
            if (asObject(triggerConfig.get("employee")) != null) {
                employee = asObject(triggerConfig.get("employee"));
            } else if (looksLikeEmployee(triggerConfig)) {
                employee = triggerConfig;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        if (employee != null) {
            result.put("employee", employee);
            result.putAll(employee);
        } else {
            result.put("employee", Map.of());
        }
        if (obj != null) {
            result.putAll(obj);
        }
        return result;
    }

    static boolean looksLikeEmployee(Map<String, Object> candidate) {
        return candidate.get("email") instanceof String
                || candidate.get("name") instanceof String
                || candidate.get("department") instanceof String
                || candidate.get("role") instanceof String;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }
}
