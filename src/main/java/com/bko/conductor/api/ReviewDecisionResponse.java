package com.bko.conductor.api;

import com.bko.conductor.orchestration.model.ControlOutcome;

public record ReviewDecisionResponse(
        String status,
        String message
) {
    public static ReviewDecisionResponse success(String decision) {
        return new ReviewDecisionResponse("success", "Plan " + decision + ".");
    }

    public static ReviewDecisionResponse notFound() {
        return new ReviewDecisionResponse("not-found", "Run not found.");
    }

    public static ReviewDecisionResponse conflict() {
        return new ReviewDecisionResponse("conflict", "Run is not awaiting plan review.");
    }

    public static ReviewDecisionResponse from(ControlOutcome outcome, String decision) {
        return switch (outcome) {
            case APPLIED -> success(decision);
            case NOT_FOUND -> notFound();
            case CONFLICT -> conflict();
        };
    }
}
