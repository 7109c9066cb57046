package com.bko.conductor.orchestration.service;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cancellation shared by every invocation of one run. Tracks the ids of in-flight invocations so they
 * can be terminated explicitly, and carries a generation counter that deferred continuations compare
 * against before they touch run state.
 */
@Slf4j
public class CancellationSignal {

    private final AtomicBoolean aborted = new AtomicBoolean();
    private final AtomicLong generation = new AtomicLong();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Set<String> activeInvocationIds = ConcurrentHashMap.newKeySet();

    /** @return {@code true} only for the call that actually aborted the signal */
    public boolean abort() {
        if (!aborted.compareAndSet(false, true)) {
            return false;
        }
        generation.incrementAndGet();
        for (Runnable listener : listeners) {
            deliverSafely(listener);
        }
        listeners.clear();
        return true;
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Registers a callback fired once on abort, immediately if already aborted.
     *
     * @return handle that removes the callback
     */
    public Runnable onAbort(Runnable listener) {
        if (isAborted()) {
            deliverSafely(listener);
            return () -> { };
        }
        listeners.add(listener);
        if (isAborted() && listeners.remove(listener)) {
            deliverSafely(listener);
        }
        return () -> listeners.remove(listener);
    }

    public long generation() {
        return generation.get();
    }

    public boolean isCurrent(long expectedGeneration) {
        return !isAborted() && generation.get() == expectedGeneration;
    }

    public void track(String invocationId) {
        activeInvocationIds.add(invocationId);
    }

    public void untrack(String invocationId) {
        activeInvocationIds.remove(invocationId);
    }

    /** Returns and forgets every tracked invocation id. */
    public Set<String> drainTracked() {
        Set<String> drained = Set.copyOf(activeInvocationIds);
        activeInvocationIds.removeAll(drained);
        return drained;
    }

    public int trackedCount() {
        return activeInvocationIds.size();
    }

    private void deliverSafely(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException ex) {
            log.warn("Abort listener failed: {}", ex.getMessage(), ex);
        }
    }
}
