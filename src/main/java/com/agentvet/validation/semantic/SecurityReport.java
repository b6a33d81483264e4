package com.agentvet.validation.semantic;

import com.agentvet.validation.Finding;

import java.util.List;

/**
 * Semantic findings grouped by risk. {@code safe} requires both zero
 * errors and zero warnings.
 */
public record SecurityReport(boolean safe, RiskLevel riskLevel, Summary summary, Issues issues) {

    public record Summary(int critical, int high, int medium, int low) {}

    public record Issues(List<Finding> critical, List<Finding> high, List<Finding> medium, List<Finding> low) {}
}
