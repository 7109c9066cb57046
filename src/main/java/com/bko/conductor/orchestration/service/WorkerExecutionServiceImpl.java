package com.bko.conductor.orchestration.service;

import com.bko.conductor.config.ConductorProperties;
import com.bko.conductor.orchestration.OrchestrationRun;
import com.bko.conductor.orchestration.RunMdc;
import com.bko.conductor.orchestration.api.ModelInvocationService;
import com.bko.conductor.orchestration.api.WorkerExecutionService;
import com.bko.conductor.orchestration.model.InvocationRequest;
import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.bko.conductor.orchestration.model.WaveSettings;
import com.bko.conductor.orchestration.model.WorkerResult;
import com.bko.conductor.orchestration.model.WorkerStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.bko.conductor.orchestration.OrchestrationConstants.CRITICAL_FAILURE_ERROR;
import static com.bko.conductor.orchestration.OrchestrationConstants.PURPOSE_RESEARCH_WORKER;
import static com.bko.conductor.orchestration.OrchestrationConstants.PURPOSE_WORKER_RETRY;
import static com.bko.conductor.orchestration.OrchestrationConstants.PURPOSE_WORKER_TASK;
import static com.bko.conductor.orchestration.OrchestrationConstants.WORKER_FAILED_MESSAGE;

@Service
@Slf4j
public class WorkerExecutionServiceImpl implements WorkerExecutionService {

    private final ModelInvocationService invocationService;
    private final FailoverRegistry failoverRegistry;
    private final ModelCatalog modelCatalog;
    private final OrchestrationPromptService promptService;
    private final OrchestrationMetricsService metricsService;
    private final ConductorProperties properties;
    private final ExecutorService workerExecutor;

    public WorkerExecutionServiceImpl(ModelInvocationService invocationService,
                                      FailoverRegistry failoverRegistry,
                                      ModelCatalog modelCatalog,
                                      OrchestrationPromptService promptService,
                                      OrchestrationMetricsService metricsService,
                                      ConductorProperties properties,
                                      @Qualifier("workerExecutor") ExecutorService workerExecutor) {
        this.invocationService = invocationService;
        this.failoverRegistry = failoverRegistry;
        this.modelCatalog = modelCatalog;
        this.promptService = promptService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public List<WorkerResult> runWave(OrchestrationRun run, List<TaskSpec> wave, Map<String, String> priorOutputs,
                                      WaveSettings settings) {
        if (wave.isEmpty()) {
            return List.of();
        }
        metricsService.recordTasksExecuted(wave.size());
        long generation = run.signal().generation();
        String purpose = run.mode() == OrchestrationMode.RESEARCH ? PURPOSE_RESEARCH_WORKER : PURPOSE_WORKER_TASK;

        Map<String, WorkerResult> results = new LinkedHashMap<>();
        List<WorkerResult> firstAttempts = launchAll(run, wave, priorOutputs, settings, purpose, generation);
        firstAttempts.forEach(result -> results.put(result.taskId(), result));
        logWaveSummary(run, firstAttempts);

        List<TaskSpec> retries = retryCandidates(run, wave, results, settings.mode());
        if (!retries.isEmpty() && run.signal().isCurrent(generation)) {
            metricsService.recordTaskRetries(retries.size());
            List<WorkerResult> retried = launchAll(run, retries, priorOutputs, settings, PURPOSE_WORKER_RETRY, generation);
            for (WorkerResult result : retried) {
                results.put(result.taskId(), result);
                log.info("Retry of {} on {} finished with {}", result.taskId(), result.model(), result.status().label());
            }
        }
        return List.copyOf(results.values());
    }

    @Override
    @Nullable
    public String criticalFailureReport(Collection<TaskSpec> tasks, Map<String, WorkerResult> results) {
        List<TaskSpec> critical = tasks.stream().filter(TaskSpec::critical).toList();
        if (critical.isEmpty()) {
            return null;
        }
        boolean anyUsable = critical.stream()
                .map(task -> results.get(task.id()))
                .anyMatch(this::countsAsDelivered);
        if (anyUsable) {
            return null;
        }
        String details = critical.stream()
                .map(task -> describeFailure(task, results.get(task.id())))
                .collect(Collectors.joining("\n"));
        return CRITICAL_FAILURE_ERROR.formatted(critical.size(), details);
    }

    private List<WorkerResult> launchAll(OrchestrationRun run, List<TaskSpec> tasks, Map<String, String> priorOutputs,
                                         WaveSettings settings, String purpose, long generation) {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(settings.concurrency());
        long staggerMs = settings.stagger().toMillis();
        List<CompletableFuture<WorkerResult>> futures = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            TaskSpec task = tasks.get(i);
            long delay = staggerMs * i;
            CompletableFuture<WorkerResult> future = limiter
                    .limit(() -> CompletableFuture
                            .runAsync(() -> { }, CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, workerExecutor))
                            .thenCompose(ignored -> runWorker(run, task, priorOutputs, settings, purpose, generation)))
                    .exceptionally(ex -> failure(run, task, settings, ex));
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<WorkerResult> runWorker(OrchestrationRun run, TaskSpec task,
                                                      Map<String, String> priorOutputs, WaveSettings settings,
                                                      String purpose, long generation) {
        String requested = StringUtils.hasText(task.model()) ? task.model() : settings.defaultModel();
        if (!run.signal().isCurrent(generation)) {
            return CompletableFuture.completedFuture(WorkerResult.failed(task.id(), requested, WorkerResult.CANCELLED));
        }
        RunMdc.setTask(run.runId(), task.id());
        try {
            String model = failoverRegistry.resolve(requested);
            if (!model.equals(requested)) {
                log.info("Failover: {} -> {} for task {}", requested, model, task.id());
            }
            run.taskStarted(task.id());
            String prompt = promptService.workerPromptWithDependencies(task, priorOutputs, settings.mode());
            InvocationRequest request = InvocationRequest
                    .worker(purpose, model, settings.systemPrompt(), prompt, settings.timeout())
                    .withStreaming(text -> run.workerStreaming(task.id(), text));
            return invocationService.invoke(request, run.signal())
                    .thenApply(result -> WorkerResult.classify(result, task.id(), model, run.isCancelled()))
                    .exceptionally(ex -> WorkerResult.failed(task.id(), model, WORKER_FAILED_MESSAGE + rootMessage(ex)))
                    .thenApply(result -> {
                        run.recordResult(result);
                        return result;
                    });
        } finally {
            RunMdc.clear();
        }
    }

    private WorkerResult failure(OrchestrationRun run, TaskSpec task, WaveSettings settings, Throwable ex) {
        String model = StringUtils.hasText(task.model()) ? task.model() : settings.defaultModel();
        log.warn("Worker {} failed before producing a result: {}", task.id(), rootMessage(ex));
        WorkerResult result = WorkerResult.failed(task.id(), model, WORKER_FAILED_MESSAGE + rootMessage(ex));
        run.recordResult(result);
        return result;
    }

    /**
     * Critical tasks that ended in {@code error} for a reason other than cancellation, each paired with the
     * model its single retry should use.
     */
    private List<TaskSpec> retryCandidates(OrchestrationRun run, List<TaskSpec> wave, Map<String, WorkerResult> results,
                                           OrchestrationMode mode) {
        if (run.isCancelled()) {
            return List.of();
        }
        List<TaskSpec> retries = new ArrayList<>();
        for (TaskSpec task : wave) {
            WorkerResult result = results.get(task.id());
            if (!task.critical() || result == null || result.status() != WorkerStatus.ERROR
                    || WorkerResult.CANCELLED.equals(result.error())) {
                continue;
            }
            String retryModel = mode == OrchestrationMode.RESEARCH ? researchRetryModel(result) : task.model();
            log.info("Retrying critical task {} with {} (previous: {} on {})", task.id(), retryModel,
                    result.error(), result.model());
            retries.add(task.withModel(retryModel));
        }
        return retries;
    }

    private String researchRetryModel(WorkerResult failed) {
        if (failed.failedWithoutOutput()) {
            String fallback = modelCatalog.crossProviderFallback(failed.model());
            if (fallback != null) {
                return fallback;
            }
        }
        return modelCatalog.upgrade(failed.model());
    }

    private boolean countsAsDelivered(@Nullable WorkerResult result) {
        if (result == null) {
            return false;
        }
        if (properties.isStrictCriticalAccounting()) {
            return result.status() == WorkerStatus.SUCCESS && StringUtils.hasText(result.content());
        }
        return result.hasUsableContent();
    }

    private static String describeFailure(TaskSpec task, @Nullable WorkerResult result) {
        if (result == null) {
            return "- %s (%s): no result".formatted(task.description(), task.model());
        }
        String error = StringUtils.hasText(result.error()) ? result.error() : "unknown";
        return "- %s (%s): %s - %s".formatted(task.description(), result.model(), result.status().label(), error);
    }

    private static void logWaveSummary(OrchestrationRun run, List<WorkerResult> results) {
        long succeeded = results.stream().filter(result -> result.status() == WorkerStatus.SUCCESS).count();
        long partial = results.stream().filter(result -> result.status() == WorkerStatus.PARTIAL).count();
        long failed = results.size() - succeeded - partial;
        log.info("Run {} wave finished: {} succeeded, {} partial, {} failed", run.runId(), succeeded, partial, failed);
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
