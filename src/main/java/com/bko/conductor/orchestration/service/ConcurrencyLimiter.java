package com.bko.conductor.orchestration.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs at most {@code concurrency} asynchronous jobs at once. Excess jobs wait in arrival order and
 * start as slots free up.
 */
public class ConcurrencyLimiter {

    private final int concurrency;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Runnable> queue = new ArrayDeque<>();
    private int active;

    public ConcurrencyLimiter(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        this.concurrency = concurrency;
    }

    /**
     * Starts {@code job} now if a slot is free, otherwise queues it. The job supplier is called on the
     * thread that frees the slot, so it should only kick off asynchronous work.
     */
    public <T> CompletableFuture<T> limit(Supplier<? extends CompletionStage<T>> job) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable start = () -> launch(job, result);
        boolean startNow;
        lock.lock();
        try {
            if (active < concurrency) {
                active++;
                startNow = true;
            } else {
                queue.addLast(start);
                startNow = false;
            }
        } finally {
            lock.unlock();
        }
        if (startNow) {
            start.run();
        }
        return result;
    }

    public int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private <T> void launch(Supplier<? extends CompletionStage<T>> job, CompletableFuture<T> result) {
        CompletionStage<T> stage;
        try {
            stage = job.get();
        } catch (RuntimeException ex) {
            stage = CompletableFuture.failedFuture(ex);
        }
        stage.whenComplete((value, error) -> {
            release();
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
    }

    private void release() {
        List<Runnable> ready = new ArrayList<>();
        lock.lock();
        try {
            active--;
            while (!queue.isEmpty() && active < concurrency) {
                active++;
                ready.add(queue.pollFirst());
            }
        } finally {
            lock.unlock();
        }
        ready.forEach(Runnable::run);
    }
}
