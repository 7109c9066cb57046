package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Parameters for a single model invocation.
 *
 * @param purpose          label used for metrics and logs ({@code plan}, {@code worker-task}, ...)
 * @param model            canonical model id
 * @param systemPrompt     optional system prompt
 * @param prompt           user message
 * @param toolsEnabled     whether registered tool callbacks are offered to the model
 * @param maxTurns         agentic turn limit; {@code 1} means a single response with no tool loop
 * @param timeout          hard deadline for the invocation
 * @param onStreamingText  receives the full text accumulated so far on every streamed chunk
 */
public record InvocationRequest(
        String purpose,
        String model,
        @Nullable String systemPrompt,
        String prompt,
        boolean toolsEnabled,
        @Nullable Integer maxTurns,
        Duration timeout,
        Consumer<String> onStreamingText
) {
    private static final Consumer<String> IGNORE_STREAMING = text -> { };

    public InvocationRequest {
        onStreamingText = onStreamingText == null ? IGNORE_STREAMING : onStreamingText;
    }

    /** Single-turn request with tools disabled, used by planning, gap-check, synthesis and quality checks. */
    public static InvocationRequest reasoning(String purpose, String model, @Nullable String systemPrompt,
                                              String prompt, Duration timeout) {
        return new InvocationRequest(purpose, model, systemPrompt, prompt, false, 1, timeout, IGNORE_STREAMING);
    }

    /** Tool-enabled request used by workers. */
    public static InvocationRequest worker(String purpose, String model, @Nullable String systemPrompt,
                                           String prompt, Duration timeout) {
        return new InvocationRequest(purpose, model, systemPrompt, prompt, true, null, timeout, IGNORE_STREAMING);
    }

    public InvocationRequest withModel(String newModel) {
        return new InvocationRequest(purpose, newModel, systemPrompt, prompt, toolsEnabled, maxTurns, timeout,
                onStreamingText);
    }

    public InvocationRequest withStreaming(Consumer<String> callback) {
        return new InvocationRequest(purpose, model, systemPrompt, prompt, toolsEnabled, maxTurns, timeout, callback);
    }

    public boolean singleTurn() {
        return maxTurns != null && maxTurns <= 1;
    }
}
