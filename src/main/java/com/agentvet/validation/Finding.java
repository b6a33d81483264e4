package com.agentvet.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One reported issue. Codes are namespaced per validator
 * ({@code STRUCT_}, {@code INT_}, {@code SEM_}, {@code REF_}).
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Finding(
        String code,
        Severity severity,
        String message,
        FindingLocation location,
        String context,
        Map<String, String> metadata
) {
    public Finding {
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Finding(String code, Severity severity, String message) {
        this(code, severity, message, null, null, Map.of());
    }

    public String detail(String key) {
        return metadata.get(key);
    }
}
