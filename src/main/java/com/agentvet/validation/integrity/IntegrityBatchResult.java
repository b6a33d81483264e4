package com.agentvet.validation.integrity;

import java.util.List;

public record IntegrityBatchResult(
        int total,
        int passed,
        int failed,
        int warnings,
        List<Entry> components
) {
    public record Entry(String path, boolean valid, String hash, int errors, int warnings) {}
}
