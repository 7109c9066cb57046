package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;

public record CooldownInfo(
        String model,
        long remainingMs,
        int failures,
        String reason,
        @Nullable String failoverModel
) {
}
