package com.agentvet.validation.semantic;

import java.util.Locale;

public enum RiskLevel {
    CRITICAL, HIGH, MEDIUM, LOW;

    /** Lower-case form used in finding metadata ({@code riskSeverity}). */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
