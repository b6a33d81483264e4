package com.agentvet.validation;

import java.util.List;

public record BatchResult(Summary summary, List<AggregateResult> components) {

    public BatchResult {
        components = components == null ? List.of() : List.copyOf(components);
    }

    public record Summary(int total, int passed, int failed, int warnings) {}
}
