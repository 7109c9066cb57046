package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

public record OrchestrationResult(
        String runId,
        OrchestrationPhase phase,
        String content,
        double totalCost,
        long totalDurationMs,
        @Nullable String error,
        boolean cancelled,
        List<String> sources
) {
    public OrchestrationResult {
        content = content == null ? "" : content;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public boolean succeeded() {
        return phase == OrchestrationPhase.DONE;
    }
}
