package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;

/**
 * Terminal result of one model invocation. {@code stderr} carries the provider or transport
 * error text and is what rate-limit detection inspects.
 */
public record InvocationResult(
        String content,
        @Nullable Double cost,
        @Nullable TokenUsage tokens,
        @Nullable Long durationMs,
        @Nullable String stderr,
        InvocationOutcome outcome
) {
    public InvocationResult {
        content = content == null ? "" : content;
    }

    public static InvocationResult success(String content, @Nullable Double cost, @Nullable TokenUsage tokens,
                                           @Nullable Long durationMs) {
        return new InvocationResult(content, cost, tokens, durationMs, null, InvocationOutcome.SUCCESS);
    }

    public static InvocationResult partial(String content, @Nullable TokenUsage tokens, long durationMs, String stderr) {
        return new InvocationResult(content, null, tokens, durationMs, stderr, InvocationOutcome.PARTIAL);
    }

    public static InvocationResult error(String stderr) {
        return new InvocationResult("", null, null, null, stderr, InvocationOutcome.ERROR);
    }

    public String firstStderrLine() {
        if (stderr == null || stderr.isBlank()) {
            return "";
        }
        return stderr.strip().lines().findFirst().orElse("");
    }
}
