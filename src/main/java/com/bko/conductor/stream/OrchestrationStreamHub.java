package com.bko.conductor.stream;

import com.bko.conductor.orchestration.model.OrchestrationPhase;
import com.bko.conductor.orchestration.model.OrchestrationSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run event buffers and the WebSocket sessions subscribed to them. Snapshots arrive through
 * {@link #publishSnapshot}; every other event type through {@link #emit}.
 */
@Component
public class OrchestrationStreamHub {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationStreamHub.class);
    static final int MAX_BUFFER_SIZE = 500;
    static final Duration CLEANUP_TTL = Duration.ofMinutes(30);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, StreamRun> runs = new ConcurrentHashMap<>();

    public OrchestrationStreamHub(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String createRun() {
        cleanupExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new StreamRun(runId, MAX_BUFFER_SIZE, clock.instant()));
        return runId;
    }

    public boolean hasRun(String runId) {
        return runs.containsKey(runId);
    }

    public void registerSession(String runId, WebSocketSession session, long sinceId) throws IOException {
        StreamRun run = runs.get(runId);
        if (run == null) {
            session.close();
            return;
        }
        cleanupExpiredRuns();
        run.sessions().put(session.getId(), session);
        session.getAttributes().put("runId", runId);
        for (StreamEvent event : run.eventsSince(sinceId)) {
            send(session, event);
        }
    }

    public void removeSession(WebSocketSession session) {
        Object runIdObj = session.getAttributes().get("runId");
        if (runIdObj == null) {
            return;
        }
        StreamRun run = runs.get(runIdObj.toString());
        if (run == null) {
            return;
        }
        run.sessions().remove(session.getId());
        pruneIfExpired(run);
    }

    public void publishSnapshot(String runId, OrchestrationSnapshot snapshot) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return;
        }
        broadcast(run, run.appendSnapshot(snapshot, clock.instant()));
    }

    public void emit(String runId, StreamEventType type, Object data) {
        Assert.isTrue(type != StreamEventType.SNAPSHOT, "Snapshots go through publishSnapshot");
        StreamRun run = runs.get(runId);
        if (run == null) {
            return;
        }
        broadcast(run, run.append(type, data, clock.instant()));
        if (type.closesRun()) {
            pruneIfExpired(run);
        }
    }

    /**
     * Marks the run cancelled and records the phase it was in. Repeated calls and calls after the run
     * completed emit nothing.
     *
     * @return {@code false} only for unknown runs
     */
    public boolean cancelRun(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        StreamEvent event = run.cancel(clock.instant());
        if (event != null) {
            log.debug("Stream for run {} cancelled during {}", runId, run.cancelledDuring().label());
            broadcast(run, event);
        }
        return true;
    }

    public boolean isCancelled(String runId) {
        StreamRun run = runs.get(runId);
        return run != null && run.cancelled();
    }

    public Optional<OrchestrationPhase> cancelledDuring(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(StreamRun::cancelledDuring);
    }

    List<StreamEvent> eventsSince(String runId, long sinceId) {
        StreamRun run = runs.get(runId);
        return run == null ? List.of() : run.eventsSince(sinceId);
    }

    private void broadcast(StreamRun run, @Nullable StreamEvent event) {
        if (event == null) {
            return;
        }
        run.sessions().values().forEach(session -> send(session, event));
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize {} event #{}: {}", event.type().label(), event.id(), ex.getMessage());
        } catch (IOException ex) {
            log.debug("Failed to send stream event: {}", ex.getMessage());
        }
    }

    private void pruneIfExpired(StreamRun run) {
        if (isExpired(run, clock.instant().minus(CLEANUP_TTL))) {
            runs.remove(run.runId());
        }
    }

    private void cleanupExpiredRuns() {
        Instant cutoff = clock.instant().minus(CLEANUP_TTL);
        runs.values().removeIf(run -> isExpired(run, cutoff));
    }

    private static boolean isExpired(StreamRun run, Instant cutoff) {
        return run.completed() && run.sessions().isEmpty() && run.lastUpdated().isBefore(cutoff);
    }
}
