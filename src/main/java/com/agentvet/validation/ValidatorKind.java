package com.agentvet.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The four validators, in the order the orchestrator runs them.
 */
public enum ValidatorKind {
    STRUCTURAL("structural", "STRUCT"),
    INTEGRITY("integrity", "INT"),
    SEMANTIC("semantic", "SEM"),
    REFERENCE("reference", "REF");

    private final String id;
    private final String codePrefix;

    ValidatorKind(String id, String codePrefix) {
        this.id = id;
        this.codePrefix = codePrefix;
    }

    @JsonValue
    public String id() { return id; }

    public String codePrefix() { return codePrefix; }

    @JsonCreator
    public static ValidatorKind fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (ValidatorKind kind : values()) {
                if (kind.id.equals(normalized)) return kind;
            }
        }
        throw new IllegalArgumentException("Unknown validator: " + id);
    }
}
