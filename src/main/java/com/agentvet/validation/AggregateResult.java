package com.agentvet.validation;

import com.agentvet.component.ComponentType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merged verdict for one document. {@code validators} holds only the
 * validators that ran, keyed by {@link ValidatorKind#id()} in run order.
 */
public record AggregateResult(
        ComponentSummary component,
        Overall overall,
        Map<String, ValidatorResult> validators
) {
    public AggregateResult {
        validators = validators == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(validators));
    }

    public ValidatorResult validator(ValidatorKind kind) {
        return validators.get(kind.id());
    }

    public record ComponentSummary(String path, ComponentType type) {}

    public record Overall(boolean valid, int errorCount, int warningCount, int score) {}
}
