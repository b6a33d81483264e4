package com.agentvet.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Severity is required");
        }
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
