package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * How one wave of workers is launched.
 *
 * @param concurrency   limiter budget for the wave
 * @param stagger       delay multiplied by each task's launch index
 * @param timeout       per-worker deadline
 * @param systemPrompt  system prompt shared by the wave's workers
 * @param defaultModel  model used when a task carries none
 */
public record WaveSettings(
        OrchestrationMode mode,
        int concurrency,
        Duration stagger,
        Duration timeout,
        @Nullable String systemPrompt,
        String defaultModel
) {
}
