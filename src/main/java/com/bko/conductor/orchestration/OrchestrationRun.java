package com.bko.conductor.orchestration;

import com.bko.conductor.orchestration.api.ModelInvocationService;
import com.bko.conductor.orchestration.api.OrchestrationListener;
import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.OrchestrationPhase;
import com.bko.conductor.orchestration.model.OrchestrationResult;
import com.bko.conductor.orchestration.model.OrchestrationSnapshot;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import com.bko.conductor.orchestration.model.RunOptions;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.bko.conductor.orchestration.model.WorkerResult;
import com.bko.conductor.orchestration.service.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable state of one orchestration run plus its control entry points. All state is guarded by the
 * run's monitor; observers only ever receive copies.
 *
 * <p>Phase changes and worker results are emitted immediately. Streaming text is emitted at most once
 * per throttle interval.
 */
@Slf4j
public class OrchestrationRun {

    private final String runId;
    private final String userMessage;
    private final RunOptions options;
    private final Clock clock;
    private final Instant startTime;
    private final long streamThrottleMs;
    private final OrchestrationListener listener;
    private final CancellationSignal signal = new CancellationSignal();
    private final CompletableFuture<OrchestrationResult> completion = new CompletableFuture<>();
    private final Object emitLock = new Object();

    private OrchestrationPhase phase = OrchestrationPhase.PLANNING;
    private OrchestratorPlan plan;
    private final Map<String, WorkerResult> results = new LinkedHashMap<>();
    private final Set<String> activeTaskIds = new LinkedHashSet<>();
    private final Map<String, String> streamingText = new LinkedHashMap<>();
    private final List<TaskSpec> followUpTasks = new ArrayList<>();
    private final List<String> sources = new ArrayList<>();
    private double totalCost;
    private String planningText;
    private String synthesisText;
    private String error;
    private CompletableFuture<Boolean> approval;
    private OrchestrationPhase cancelledDuring;
    private boolean rejected;
    private long lastStreamEmit;
    private long version;
    private long deliveredVersion;

    public OrchestrationRun(String runId, String userMessage, RunOptions options, Clock clock,
                            Duration streamThrottle, OrchestrationListener listener) {
        this.runId = runId;
        this.userMessage = userMessage;
        this.options = options;
        this.clock = clock;
        this.startTime = clock.instant();
        this.streamThrottleMs = streamThrottle.toMillis();
        this.listener = listener == null ? OrchestrationListener.NONE : listener;
    }

    public String runId() {
        return runId;
    }

    public String userMessage() {
        return userMessage;
    }

    public RunOptions options() {
        return options;
    }

    public OrchestrationMode mode() {
        return options.mode();
    }

    public CancellationSignal signal() {
        return signal;
    }

    public CompletableFuture<OrchestrationResult> completion() {
        return completion;
    }

    public boolean isCancelled() {
        return signal.isAborted();
    }

    public synchronized OrchestrationPhase phase() {
        return phase;
    }

    public synchronized double totalCost() {
        return totalCost;
    }

    public synchronized boolean wasRejected() {
        return rejected;
    }

    @Nullable
    public synchronized OrchestrationPhase cancelledDuring() {
        return cancelledDuring;
    }

    public long elapsedMs() {
        return Duration.between(startTime, clock.instant()).toMillis();
    }

    public synchronized Map<String, WorkerResult> results() {
        return new LinkedHashMap<>(results);
    }

    public synchronized List<String> sources() {
        return List.copyOf(sources);
    }

    /** Publishes the initial {@code PLANNING} snapshot. */
    public void begin() {
        log.info("Run {} started ({} mode)", runId, options.mode());
        emit();
    }

    public void transition(OrchestrationPhase next) {
        synchronized (this) {
            if (phase.isTerminal()) {
                return;
            }
            log.info("Run {} phase {} -> {}", runId, phase.label(), next.label());
            phase = next;
        }
        emit();
    }

    public void setPlan(OrchestratorPlan newPlan) {
        synchronized (this) {
            plan = newPlan;
        }
        emit();
    }

    public void taskStarted(String taskId) {
        synchronized (this) {
            activeTaskIds.add(taskId);
        }
        emit();
    }

    /** Records a finished attempt. A later attempt for the same task replaces the earlier one. */
    public void recordResult(WorkerResult result) {
        synchronized (this) {
            results.put(result.taskId(), result);
            activeTaskIds.remove(result.taskId());
            streamingText.remove(result.taskId());
            totalCost += result.costOrZero();
        }
        emit();
    }

    public void workerStreaming(String taskId, String text) {
        synchronized (this) {
            if (!activeTaskIds.contains(taskId)) {
                return;
            }
            streamingText.put(taskId, text);
        }
        throttledEmit();
    }

    public void planningStreaming(String text) {
        synchronized (this) {
            planningText = text;
        }
        throttledEmit();
    }

    public void synthesisStreaming(String text) {
        synchronized (this) {
            synthesisText = text;
        }
        throttledEmit();
    }

    public synchronized void addCost(@Nullable Double cost) {
        if (cost != null) {
            totalCost += cost;
        }
    }

    public void addFollowUps(List<TaskSpec> tasks) {
        synchronized (this) {
            followUpTasks.addAll(tasks);
        }
        emit();
    }

    public void addSources(List<String> extracted) {
        synchronized (this) {
            for (String source : extracted) {
                if (!sources.contains(source)) {
                    sources.add(source);
                }
            }
        }
        emit();
    }

    /**
     * Enters {@code REVIEWING} and returns a future completed by {@link #approve()}, {@link #reject(ModelInvocationService)} or
     * cancellation. The future exists before the phase is published so an immediate decision is never lost.
     */
    public CompletableFuture<Boolean> openReviewGate() {
        CompletableFuture<Boolean> gate = new CompletableFuture<>();
        synchronized (this) {
            approval = gate;
            if (signal.isAborted()) {
                gate.complete(false);
            }
        }
        transition(OrchestrationPhase.REVIEWING);
        return gate;
    }

    public boolean approve() {
        CompletableFuture<Boolean> gate;
        synchronized (this) {
            if (phase != OrchestrationPhase.REVIEWING || approval == null) {
                return false;
            }
            gate = approval;
            approval = null;
        }
        log.info("Run {} plan approved", runId);
        return gate.complete(true);
    }

    /**
     * Rejecting the plan is a full stop: the run is cancelled with no fallback.
     */
    public boolean reject(ModelInvocationService terminator) {
        synchronized (this) {
            if (phase != OrchestrationPhase.REVIEWING || approval == null) {
                return false;
            }
            rejected = true;
        }
        log.info("Run {} plan rejected", runId);
        cancel(terminator);
        return true;
    }

    /**
     * Aborts the shared signal, resolves a pending review with "reject" and terminates every tracked
     * invocation. Safe to call repeatedly.
     *
     * @return {@code true} if this call cancelled the run
     */
    public boolean cancel(ModelInvocationService terminator) {
        CompletableFuture<Boolean> gate;
        synchronized (this) {
            if (phase.isTerminal() || signal.isAborted()) {
                return false;
            }
            cancelledDuring = phase;
            gate = approval;
            approval = null;
        }
        boolean aborted = signal.abort();
        if (gate != null) {
            gate.complete(false);
        }
        if (!aborted) {
            return false;
        }
        log.info("Run {} cancelled during {}", runId, cancelledDuring().label());
        for (String invocationId : signal.drainTracked()) {
            terminator.terminate(invocationId);
        }
        return true;
    }

    public OrchestrationResult finish(String content) {
        synchronized (this) {
            if (phase.isTerminal()) {
                return completion.join();
            }
            phase = OrchestrationPhase.DONE;
            clearLiveState();
        }
        log.info("Run {} done in {}ms (cost {})", runId, elapsedMs(), totalCost());
        emit();
        return complete(new OrchestrationResult(runId, OrchestrationPhase.DONE, content, totalCost(), elapsedMs(),
                null, false, sources()));
    }

    public OrchestrationResult fail(String message) {
        boolean cancelled = isCancelled();
        synchronized (this) {
            if (phase.isTerminal()) {
                return completion.join();
            }
            phase = OrchestrationPhase.ERROR;
            error = message;
            clearLiveState();
        }
        if (cancelled) {
            log.info("Run {} ended: {}", runId, message);
        } else {
            log.error("Run {} failed: {}", runId, message);
        }
        emit();
        return complete(new OrchestrationResult(runId, OrchestrationPhase.ERROR, "", totalCost(), elapsedMs(),
                message, cancelled, sources()));
    }

    public OrchestrationSnapshot snapshot() {
        synchronized (this) {
            return buildSnapshot();
        }
    }

    private OrchestrationResult complete(OrchestrationResult result) {
        completion.complete(result);
        return result;
    }

    private void clearLiveState() {
        activeTaskIds.clear();
        streamingText.clear();
        approval = null;
    }

    private void throttledEmit() {
        synchronized (this) {
            long now = clock.millis();
            if (now - lastStreamEmit < streamThrottleMs) {
                return;
            }
            lastStreamEmit = now;
        }
        emit();
    }

    private void emit() {
        OrchestrationSnapshot snapshot;
        long snapshotVersion;
        synchronized (this) {
            snapshotVersion = ++version;
            snapshot = buildSnapshot();
        }
        synchronized (emitLock) {
            if (snapshotVersion < deliveredVersion) {
                return;
            }
            deliveredVersion = snapshotVersion;
            try {
                listener.onSnapshot(snapshot);
            } catch (RuntimeException ex) {
                log.warn("Snapshot listener failed for run {}: {}", runId, ex.getMessage(), ex);
            }
        }
    }

    private OrchestrationSnapshot buildSnapshot() {
        boolean reviewing = phase == OrchestrationPhase.REVIEWING && approval != null;
        return new OrchestrationSnapshot(
                runId,
                options.mode(),
                phase,
                plan,
                Collections.unmodifiableMap(new LinkedHashMap<>(results)),
                Collections.unmodifiableSet(new LinkedHashSet<>(activeTaskIds)),
                Collections.unmodifiableMap(new LinkedHashMap<>(streamingText)),
                List.copyOf(followUpTasks),
                List.copyOf(sources),
                totalCost,
                startTime,
                planningText,
                synthesisText,
                error,
                reviewing,
                reviewing,
                !phase.isTerminal() && !signal.isAborted());
    }
}
