package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.model.InvocationOutcome;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong llmFailureCount = new AtomicLong();
    private final AtomicLong planResponseCount = new AtomicLong();
    private final AtomicLong taskReceivedCount = new AtomicLong();
    private final AtomicLong taskExecutedCount = new AtomicLong();
    private final AtomicLong taskRetryCount = new AtomicLong();
    private final Map<String, AtomicLong> requestsByPurpose = new ConcurrentHashMap<>();

    public void recordLlmRequest(String purpose, String model) {
        long count = llmRequestCount.incrementAndGet();
        requestsByPurpose.computeIfAbsent(purpose, key -> new AtomicLong()).incrementAndGet();
        log.info("LLM request #{} sent (purpose={}, model={}). Total requests={}.", count, purpose, model, count);
    }

    public void recordLlmOutcome(String purpose, String model, InvocationOutcome outcome, long durationMs) {
        if (outcome == InvocationOutcome.ERROR) {
            long failures = llmFailureCount.incrementAndGet();
            log.info("LLM request failed (purpose={}, model={}) after {}ms. Total failures={}.",
                    purpose, model, durationMs, failures);
        } else if (log.isDebugEnabled()) {
            log.debug("LLM request finished (purpose={}, model={}, outcome={}) in {}ms.",
                    purpose, model, outcome, durationMs);
        }
    }

    public void recordPlanResponse(String label, @Nullable OrchestratorPlan plan) {
        long planCount = planResponseCount.incrementAndGet();
        if (plan == null) {
            log.info("Plan response #{} ({}) returned no tasks. Total plans={}.", planCount, label, planCount);
            return;
        }
        int taskCount = plan.tasks().size();
        long totalTasks = taskReceivedCount.addAndGet(taskCount);
        log.info("Plan response #{} ({}) received {} tasks. Total plans={}, total tasks received={}.",
                planCount, label, taskCount, planCount, totalTasks);
    }

    public void recordTasksExecuted(int executedCount) {
        if (executedCount <= 0) {
            return;
        }
        long totalExecuted = taskExecutedCount.addAndGet(executedCount);
        log.info("Executing {} plan tasks. Total tasks executed so far={}.", executedCount, totalExecuted);
    }

    public void recordTaskRetries(int retryCount) {
        if (retryCount <= 0) {
            return;
        }
        long totalRetries = taskRetryCount.addAndGet(retryCount);
        log.info("Retrying {} critical tasks. Total retries so far={}.", retryCount, totalRetries);
    }

    public long requestCount(String purpose) {
        AtomicLong counter = requestsByPurpose.get(purpose);
        return counter == null ? 0 : counter.get();
    }

    public void logSummary() {
        log.info("LLM stats: totalRequests={}, failures={}, totalPlans={}, totalTasksReceived={}, "
                        + "totalTasksExecuted={}, totalRetries={}, byPurpose={}.",
                llmRequestCount.get(), llmFailureCount.get(), planResponseCount.get(), taskReceivedCount.get(),
                taskExecutedCount.get(), taskRetryCount.get(), requestsByPurpose);
    }
}
