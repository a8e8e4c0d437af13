package com.hrflow.hrflow_backend.service;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of parsing one uploaded CV. {@code data} always carries the candidate fields,
 * null or empty when parsing failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CvParseResult(
        boolean success,
        String source,
        String filename,
        Map<String, Object> data,
        String error
) {

    public static CvParseResult success(String filename, Map<String, Object> data) {
        return new CvParseResult(true, "file", filename, data, null);
    }

    public static CvParseResult failure(String filename, String error) {
        return new CvParseResult(false, "file", filename, emptyCandidate(), error);
    }

    static Map<String, Object> emptyCandidate() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", null);
        data.put("email", null);
        data.put("phone", null);
        data.put("skills", new ArrayList<>());
        data.put("experience_years", null);
        data.put("education", new ArrayList<>());
        return data;
    }
}
