package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;

public record QualityCheckResult(
        int score,
        boolean pass,
        @Nullable String issues
) {
}
