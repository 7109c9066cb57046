package com.bko.conductor.orchestration.api;

import com.bko.conductor.orchestration.model.OrchestrationSnapshot;

/**
 * Receives a copy of the run state on every phase transition, worker result and throttled streaming update.
 */
@FunctionalInterface
public interface OrchestrationListener {

    OrchestrationListener NONE = snapshot -> { };

    void onSnapshot(OrchestrationSnapshot snapshot);

    default OrchestrationListener andThen(OrchestrationListener next) {
        return snapshot -> {
            onSnapshot(snapshot);
            next.onSnapshot(snapshot);
        };
    }
}
