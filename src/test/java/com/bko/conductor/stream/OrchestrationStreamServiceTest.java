package com.bko.conductor.stream;

import com.bko.conductor.orchestration.api.OrchestrationListener;
import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.OrchestrationPhase;
import com.bko.conductor.orchestration.model.OrchestrationResult;
import com.bko.conductor.orchestration.model.OrchestrationSnapshot;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import com.bko.conductor.orchestration.model.TaskPriority;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationStreamServiceTest {

    private final OrchestrationStreamHub hub = new OrchestrationStreamHub(new ObjectMapper().findAndRegisterModules(),
            Clock.systemUTC());
    private final OrchestrationStreamService service = new OrchestrationStreamService(hub);

    @Test
    void testListenerEmitsStatusAndPlanOnlyOnChange() {
        String runId = service.createRun();
        OrchestrationListener listener = service.listenerFor(runId);
        OrchestratorPlan plan = new OrchestratorPlan("why",
                List.of(new TaskSpec("t1", "d", "m", "p", TaskPriority.CRITICAL, List.of())), "merge");

        listener.onSnapshot(snapshot(runId, OrchestrationPhase.PLANNING, null));
        listener.onSnapshot(snapshot(runId, OrchestrationPhase.PLANNING, null));
        listener.onSnapshot(snapshot(runId, OrchestrationPhase.EXECUTING, plan));
        listener.onSnapshot(snapshot(runId, OrchestrationPhase.EXECUTING, plan));

        List<StreamEventType> types = hub.eventsSince(runId, 0).stream().map(StreamEvent::type).toList();
        assertEquals(List.of(StreamEventType.STATUS, StreamEventType.STATUS, StreamEventType.PLAN,
                StreamEventType.SNAPSHOT), types);
        List<StreamEvent> events = hub.eventsSince(runId, 0);
        assertEquals(Map.of("message", "planning"), events.get(0).data());
        assertEquals(Map.of("message", "executing"), events.get(1).data());
        assertEquals(7L, events.get(3).id());
    }

    @Test
    void testSuccessfulResultEmitsFinalThenComplete() {
        String runId = service.createRun();

        service.emitResult(runId, new OrchestrationResult(runId, OrchestrationPhase.DONE, "answer", 0.4, 1200L,
                null, false, List.of("https://example.com")));

        List<StreamEvent> events = hub.eventsSince(runId, 0);
        assertEquals(StreamEventType.FINAL, events.get(0).type());
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) events.get(0).data();
        assertEquals("answer", payload.get("finalAnswer"));
        assertEquals(List.of("https://example.com"), payload.get("sources"));
        assertEquals(Map.of("status", "COMPLETED"), events.get(1).data());
    }

    @Test
    void testCancelledResultEmitsErrorThenCancelledStatus() {
        String runId = service.createRun();
        service.cancelRun(runId);

        service.emitResult(runId, new OrchestrationResult(runId, OrchestrationPhase.ERROR, "", 0, 10L,
                "Run cancelled during reviewing", true, List.of()));

        List<StreamEvent> events = hub.eventsSince(runId, 0);
        assertEquals(StreamEventType.RUN_CANCEL, events.get(0).type());
        assertEquals(Map.of("phase", "planning"), events.get(0).data());
        assertEquals(Map.of("message", "Run cancelled during reviewing"), events.get(1).data());
        assertEquals(Map.of("status", "CANCELLED"), events.get(2).data());
    }

    private static OrchestrationSnapshot snapshot(String runId, OrchestrationPhase phase, OrchestratorPlan plan) {
        return new OrchestrationSnapshot(runId, OrchestrationMode.COMMANDER, phase, plan, Map.of(), Set.of(), Map.of(),
                List.of(), List.of(), 0.0, Instant.EPOCH, null, null, null, false, false, true);
    }
}
