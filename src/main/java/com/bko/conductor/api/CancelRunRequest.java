package com.bko.conductor.api;

import jakarta.validation.constraints.NotBlank;

public record CancelRunRequest(
        @NotBlank String runId
) {
}
