package com.bko.conductor.api;

import com.bko.conductor.orchestration.model.OrchestrationPhase;
import com.bko.conductor.orchestration.model.OrchestrationResult;

import java.util.List;

public record ChatResponse(
        String runId,
        OrchestrationPhase phase,
        String content,
        double totalCost,
        long totalDurationMs,
        String error,
        List<String> sources
) {

    public static ChatResponse from(OrchestrationResult result) {
        return new ChatResponse(result.runId(), result.phase(), result.content(), result.totalCost(),
                result.totalDurationMs(), result.error(), result.sources());
    }
}
