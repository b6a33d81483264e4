package com.agentvet.validation.semantic;

import com.agentvet.component.ComponentType;
import com.agentvet.validation.Severity;

import java.util.regex.Pattern;

/**
 * One detection rule. {@code appliesTo} restricts the rule to a single
 * component type; {@code null} means every type. Rules flagged
 * {@code redact} never echo the matched value.
 */
public record PatternRule(
        String code,
        Severity severity,
        RiskLevel risk,
        Pattern pattern,
        String message,
        ComponentType appliesTo,
        boolean redact
) {
    public boolean appliesTo(ComponentType type) {
        return appliesTo == null || appliesTo == type;
    }

    public PatternRule withSeverity(Severity value) {
        return new PatternRule(code, value, risk, pattern, message, appliesTo, redact);
    }
}
