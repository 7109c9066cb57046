package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable copy of a run's state handed to observers. Collections are copied at emission time.
 * The {@code can*} flags tell the client which control entry points are valid in the current phase.
 */
public record OrchestrationSnapshot(
        String runId,
        OrchestrationMode mode,
        OrchestrationPhase phase,
        @Nullable OrchestratorPlan plan,
        Map<String, WorkerResult> results,
        Set<String> activeTaskIds,
        Map<String, String> streamingText,
        List<TaskSpec> followUpTasks,
        List<String> sources,
        double totalCost,
        Instant startTime,
        @Nullable String planningText,
        @Nullable String synthesisText,
        @Nullable String error,
        boolean canApprove,
        boolean canReject,
        boolean canCancel
) {
}
