package com.bko.conductor.orchestration.model;

public record TokenUsage(
        long input,
        long output,
        long total
) {
}
