package com.bko.conductor.orchestration.model;

public record ModelDescriptor(
        String id,
        String label,
        ModelProvider provider
) {
}
