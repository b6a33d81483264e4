package com.agentvet.validation.integrity;

import com.agentvet.validation.Finding;

import java.util.List;

public record IntegrityReport(
        boolean valid,
        String hash,
        String version,
        String timestamp,
        List<Finding> errors,
        List<Finding> warnings
) {}
