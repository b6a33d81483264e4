package com.agentvet.validation.reference;

import com.agentvet.validation.Finding;

import java.util.List;

/**
 * Reference inventory for a document, independent of its pass/fail status.
 */
public record ReferenceReport(
        boolean safe,
        int totalReferences,
        int httpsCount,
        int httpCount,
        double httpsPercentage,
        List<Finding> errors,
        List<Finding> warnings,
        List<ReferenceStatus> references
) {
    public record ReferenceStatus(String target, Reference.Kind kind, boolean safe) {}
}
