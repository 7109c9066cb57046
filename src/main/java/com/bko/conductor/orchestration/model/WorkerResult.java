package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

public record WorkerResult(
        String taskId,
        String model,
        WorkerStatus status,
        String content,
        @Nullable Double cost,
        @Nullable TokenUsage tokens,
        @Nullable Long durationMs,
        @Nullable String error
) {
    public static final String CANCELLED = "Cancelled";
    public static final String NO_OUTPUT = "no output (timeout or invocation crash)";

    public WorkerResult {
        content = content == null ? "" : content;
    }

    public static WorkerResult failed(String taskId, String model, String error) {
        return new WorkerResult(taskId, model, WorkerStatus.ERROR, "", null, null, null, error);
    }

    /**
     * Maps a raw invocation result onto a worker result. A {@code null} result means the invocation never
     * settled normally: it was either aborted or produced nothing before the transport gave up.
     */
    public static WorkerResult classify(@Nullable InvocationResult result, String taskId, String model,
                                        boolean aborted) {
        if (result != null && result.outcome() == InvocationOutcome.SUCCESS) {
            return new WorkerResult(taskId, model, WorkerStatus.SUCCESS, result.content(), result.cost(),
                    result.tokens(), result.durationMs(), null);
        }
        if (result != null && result.outcome() == InvocationOutcome.PARTIAL) {
            return new WorkerResult(taskId, model, WorkerStatus.PARTIAL, result.content(), result.cost(),
                    result.tokens(), result.durationMs(),
                    "Timed out but " + result.content().length() + " chars preserved");
        }
        if (result != null) {
            String detail = result.firstStderrLine();
            return failed(taskId, model, StringUtils.hasText(detail) ? detail : "Unknown error");
        }
        if (aborted) {
            return failed(taskId, model, CANCELLED);
        }
        return failed(taskId, model, NO_OUTPUT);
    }

    public boolean hasUsableContent() {
        return (status == WorkerStatus.SUCCESS || status == WorkerStatus.PARTIAL) && StringUtils.hasText(content);
    }

    public boolean failedWithoutOutput() {
        return status == WorkerStatus.ERROR && error != null && error.contains("no output");
    }

    public double costOrZero() {
        return cost == null ? 0.0 : cost;
    }
}
