package com.bko.conductor.stream;

import com.bko.conductor.orchestration.model.OrchestrationPhase;
import com.bko.conductor.orchestration.model.OrchestrationSnapshot;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stream-side view of one orchestration run. Tracks the phase reported by the latest snapshot so a cancel
 * can record where it happened and later snapshots can be filtered by phase.
 * <p>
 * Only the newest snapshot is kept in the replay buffer; each one carries the full run state.
 */
class StreamRun {
    private final String runId;
    private final int maxBufferSize;
    private final Deque<StreamEvent> buffer = new ArrayDeque<>();
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private long sequence;
    @Nullable
    private StreamEvent latestSnapshot;
    private OrchestrationPhase phase = OrchestrationPhase.PLANNING;
    @Nullable
    private OrchestrationPhase cancelledDuring;
    private boolean completed;
    private Instant lastUpdated;

    StreamRun(String runId, int maxBufferSize, Instant createdAt) {
        this.runId = runId;
        this.maxBufferSize = maxBufferSize;
        this.lastUpdated = createdAt;
    }

    String runId() {
        return runId;
    }

    Map<String, WebSocketSession> sessions() {
        return sessions;
    }

    /**
     * @return the buffered event, or {@code null} when the run was cancelled and the event type is not
     *         one that reports the ending
     */
    @Nullable
    synchronized StreamEvent append(StreamEventType type, Object data, Instant now) {
        if (cancelledDuring != null && !type.deliveredAfterCancel()) {
            return null;
        }
        StreamEvent event = add(type, data, now);
        if (type.closesRun()) {
            completed = true;
        }
        return event;
    }

    /**
     * Replaces the buffered snapshot. After a cancel only the snapshot of a finished run gets through.
     */
    @Nullable
    synchronized StreamEvent appendSnapshot(OrchestrationSnapshot snapshot, Instant now) {
        if (cancelledDuring != null && !snapshot.phase().isTerminal()) {
            return null;
        }
        phase = snapshot.phase();
        if (latestSnapshot != null) {
            buffer.remove(latestSnapshot);
        }
        latestSnapshot = add(StreamEventType.SNAPSHOT, snapshot, now);
        return latestSnapshot;
    }

    /**
     * @return the {@code run-cancel} event, or {@code null} if the run was already cancelled or completed
     */
    @Nullable
    synchronized StreamEvent cancel(Instant now) {
        if (cancelledDuring != null || completed) {
            return null;
        }
        cancelledDuring = phase;
        return add(StreamEventType.RUN_CANCEL, Map.of("phase", phase.label()), now);
    }

    synchronized List<StreamEvent> eventsSince(long sinceId) {
        return buffer.stream()
                .filter(event -> event.id() > sinceId)
                .toList();
    }

    synchronized boolean cancelled() {
        return cancelledDuring != null;
    }

    @Nullable
    synchronized OrchestrationPhase cancelledDuring() {
        return cancelledDuring;
    }

    synchronized OrchestrationPhase phase() {
        return phase;
    }

    synchronized boolean completed() {
        return completed;
    }

    synchronized Instant lastUpdated() {
        return lastUpdated;
    }

    private StreamEvent add(StreamEventType type, Object data, Instant now) {
        StreamEvent event = new StreamEvent(++sequence, now, type, data);
        buffer.addLast(event);
        while (buffer.size() > maxBufferSize) {
            StreamEvent dropped = buffer.removeFirst();
            if (dropped == latestSnapshot) {
                latestSnapshot = null;
            }
        }
        lastUpdated = now;
        return event;
    }
}
