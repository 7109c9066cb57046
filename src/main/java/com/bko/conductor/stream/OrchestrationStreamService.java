package com.bko.conductor.stream;

import com.bko.conductor.orchestration.api.OrchestrationListener;
import com.bko.conductor.orchestration.model.OrchestrationPhase;
import com.bko.conductor.orchestration.model.OrchestrationResult;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class OrchestrationStreamService {

    private final OrchestrationStreamHub hub;

    public OrchestrationStreamService(OrchestrationStreamHub hub) {
        this.hub = hub;
    }

    public String createRun() {
        return hub.createRun();
    }

    /**
     * Publishes every snapshot of the run, followed by a {@code status} event on each phase change and a
     * {@code plan} event whenever the plan changes.
     */
    public OrchestrationListener listenerFor(String runId) {
        AtomicReference<OrchestrationPhase> lastPhase = new AtomicReference<>();
        AtomicReference<OrchestratorPlan> lastPlan = new AtomicReference<>();
        return snapshot -> {
            hub.publishSnapshot(runId, snapshot);
            if (snapshot.phase() != lastPhase.getAndSet(snapshot.phase())) {
                emitStatus(runId, snapshot.phase().label());
            }
            OrchestratorPlan plan = snapshot.plan();
            if (plan != null && !plan.equals(lastPlan.getAndSet(plan))) {
                emitPlan(runId, plan);
            }
        };
    }

    public void emitStatus(String runId, String message) {
        hub.emit(runId, StreamEventType.STATUS, Map.of("message", message));
    }

    public void emitPlan(String runId, OrchestratorPlan plan) {
        hub.emit(runId, StreamEventType.PLAN, plan);
    }

    public void emitResult(String runId, OrchestrationResult result) {
        if (result.succeeded()) {
            emitFinalAnswer(runId, result);
            emitRunComplete(runId, "COMPLETED");
            return;
        }
        emitError(runId, result.error());
        emitRunComplete(runId, result.cancelled() ? "CANCELLED" : "FAILED");
    }

    public void emitFinalAnswer(String runId, OrchestrationResult result) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("finalAnswer", result.content());
        payload.put("totalCost", result.totalCost());
        payload.put("totalDurationMs", result.totalDurationMs());
        payload.put("sources", result.sources());
        hub.emit(runId, StreamEventType.FINAL, payload);
    }

    public void emitRunComplete(String runId, String status) {
        hub.emit(runId, StreamEventType.RUN_COMPLETE, Map.of("status", status));
    }

    public void emitError(String runId, String message) {
        hub.emit(runId, StreamEventType.ERROR, Map.of("message", message == null ? "Unknown error" : message));
    }

    public boolean cancelRun(String runId) {
        return hub.cancelRun(runId);
    }
}
