package com.bko.conductor.api;

import com.bko.conductor.orchestration.model.ModelProvider;

/**
 * A catalog entry with its current availability and the model requests would fail over to right now.
 */
public record ModelStatusResponse(
        String id,
        String label,
        ModelProvider provider,
        boolean available,
        long cooldownRemainingMs,
        String resolvedModel
) {
}
