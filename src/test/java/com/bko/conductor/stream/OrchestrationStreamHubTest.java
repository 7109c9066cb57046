package com.bko.conductor.stream;

import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.OrchestrationPhase;
import com.bko.conductor.orchestration.model.OrchestrationSnapshot;
import com.bko.conductor.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OrchestrationStreamHubTest {

    private final MutableClock clock = MutableClock.startingAtEpoch();
    private OrchestrationStreamHub hub;

    @BeforeEach
    void setUp() {
        hub = new OrchestrationStreamHub(new ObjectMapper().findAndRegisterModules(), clock);
    }

    @Test
    void testEventsGetIncreasingIds() {
        String runId = hub.createRun();
        hub.emit(runId, StreamEventType.STATUS, Map.of("message", "planning"));
        hub.emit(runId, StreamEventType.STATUS, Map.of("message", "executing"));
        hub.emit(runId, StreamEventType.PLAN, Map.of());

        List<StreamEvent> all = hub.eventsSince(runId, 0);
        assertEquals(List.of(1L, 2L, 3L), all.stream().map(StreamEvent::id).toList());
        assertEquals(List.of(3L), hub.eventsSince(runId, 2).stream().map(StreamEvent::id).toList());
    }

    @Test
    void testBufferKeepsNewestEvents() {
        String runId = hub.createRun();
        for (int i = 0; i < OrchestrationStreamHub.MAX_BUFFER_SIZE + 10; i++) {
            hub.emit(runId, StreamEventType.STATUS, Map.of("i", i));
        }

        List<StreamEvent> events = hub.eventsSince(runId, 0);
        assertEquals(OrchestrationStreamHub.MAX_BUFFER_SIZE, events.size());
        assertEquals(11L, events.get(0).id());
    }

    @Test
    void testOnlyNewestSnapshotIsBuffered() {
        String runId = hub.createRun();
        hub.publishSnapshot(runId, snapshot(runId, OrchestrationPhase.PLANNING));
        hub.emit(runId, StreamEventType.STATUS, Map.of("message", "planning"));
        for (int i = 0; i < OrchestrationStreamHub.MAX_BUFFER_SIZE + 50; i++) {
            hub.publishSnapshot(runId, snapshot(runId, OrchestrationPhase.EXECUTING));
        }

        List<StreamEvent> events = hub.eventsSince(runId, 0);
        assertEquals(List.of(StreamEventType.STATUS, StreamEventType.SNAPSHOT),
                events.stream().map(StreamEvent::type).toList());
        assertEquals(OrchestrationStreamHub.MAX_BUFFER_SIZE + 52L, events.get(1).id());
        assertEquals(OrchestrationPhase.EXECUTING, ((OrchestrationSnapshot) events.get(1).data()).phase());
    }

    @Test
    void testSnapshotsStillReachLiveSessionsIndividually() throws Exception {
        String runId = hub.createRun();
        WebSocketSession session = openSession("s1");
        hub.registerSession(runId, session, 0);

        hub.publishSnapshot(runId, snapshot(runId, OrchestrationPhase.PLANNING));
        hub.publishSnapshot(runId, snapshot(runId, OrchestrationPhase.REVIEWING));

        verify(session, times(2)).sendMessage(any(TextMessage.class));
    }

    @Test
    void testEmitRejectsUntypedSnapshots() {
        String runId = hub.createRun();
        assertThrows(IllegalArgumentException.class, () -> hub.emit(runId, StreamEventType.SNAPSHOT, Map.of()));
    }

    @Test
    void testCancelRecordsPhaseAndDropsProgress() {
        String runId = hub.createRun();
        hub.publishSnapshot(runId, snapshot(runId, OrchestrationPhase.EXECUTING));

        assertTrue(hub.cancelRun(runId));
        assertTrue(hub.cancelRun(runId));
        assertTrue(hub.isCancelled(runId));
        assertEquals(Optional.of(OrchestrationPhase.EXECUTING), hub.cancelledDuring(runId));

        hub.emit(runId, StreamEventType.STATUS, Map.of("message", "synthesizing"));
        hub.publishSnapshot(runId, snapshot(runId, OrchestrationPhase.SYNTHESIZING));
        hub.publishSnapshot(runId, snapshot(runId, OrchestrationPhase.ERROR));
        hub.emit(runId, StreamEventType.ERROR, Map.of("message", "Run cancelled during executing"));
        hub.emit(runId, StreamEventType.RUN_COMPLETE, Map.of("status", "CANCELLED"));

        List<StreamEvent> events = hub.eventsSince(runId, 0);
        assertEquals(List.of(StreamEventType.RUN_CANCEL, StreamEventType.SNAPSHOT, StreamEventType.ERROR,
                StreamEventType.RUN_COMPLETE), events.stream().map(StreamEvent::type).toList());
        assertEquals(Map.of("phase", "executing"), events.get(0).data());
        assertEquals(OrchestrationPhase.ERROR, ((OrchestrationSnapshot) events.get(1).data()).phase());
        assertFalse(hub.cancelRun("missing"));
        assertEquals(Optional.empty(), hub.cancelledDuring("missing"));
    }

    @Test
    void testCancelAfterCompletionEmitsNothing() {
        String runId = hub.createRun();
        hub.emit(runId, StreamEventType.RUN_COMPLETE, Map.of("status", "COMPLETED"));

        assertTrue(hub.cancelRun(runId));

        assertFalse(hub.isCancelled(runId));
        assertEquals(List.of(StreamEventType.RUN_COMPLETE),
                hub.eventsSince(runId, 0).stream().map(StreamEvent::type).toList());
    }

    @Test
    void testCompletedRunsExpireAfterTtl() {
        String finished = hub.createRun();
        hub.emit(finished, StreamEventType.RUN_COMPLETE, Map.of("status", "COMPLETED"));
        String active = hub.createRun();
        hub.emit(active, StreamEventType.STATUS, Map.of("message", "executing"));

        clock.advance(OrchestrationStreamHub.CLEANUP_TTL.plus(Duration.ofSeconds(1)));
        hub.createRun();

        assertFalse(hub.hasRun(finished));
        assertTrue(hub.hasRun(active));
    }

    @Test
    void testSessionReceivesReplayThenLiveEvents() throws Exception {
        String runId = hub.createRun();
        hub.emit(runId, StreamEventType.STATUS, Map.of("message", "one"));
        hub.emit(runId, StreamEventType.STATUS, Map.of("message", "two"));
        WebSocketSession session = openSession("s1");

        hub.registerSession(runId, session, 1);
        ArgumentCaptor<TextMessage> replayed = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(1)).sendMessage(replayed.capture());
        assertTrue(replayed.getValue().getPayload().contains("\"type\":\"status\""));
        assertTrue(replayed.getValue().getPayload().contains("\"two\""));

        hub.emit(runId, StreamEventType.STATUS, Map.of("message", "three"));
        verify(session, times(2)).sendMessage(any(TextMessage.class));

        hub.removeSession(session);
        hub.emit(runId, StreamEventType.STATUS, Map.of("message", "four"));
        verify(session, times(2)).sendMessage(any(TextMessage.class));
    }

    @Test
    void testUnknownRunClosesSession() throws Exception {
        WebSocketSession session = openSession("s2");

        hub.registerSession("missing", session, 0);

        verify(session).close();
        verify(session, never()).sendMessage(any());
        hub.emit("missing", StreamEventType.STATUS, Map.of());
        assertFalse(hub.hasRun("missing"));
    }

    static OrchestrationSnapshot snapshot(String runId, OrchestrationPhase phase) {
        return new OrchestrationSnapshot(runId, OrchestrationMode.COMMANDER, phase, null, Map.of(), Set.of(),
                Map.of(), List.of(), List.of(), 0.0, Instant.EPOCH, null, null, null, false, false,
                !phase.isTerminal());
    }

    private static WebSocketSession openSession(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(attributes);
        return session;
    }
}
