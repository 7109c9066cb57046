package com.bko.conductor.orchestration.service;

import com.bko.conductor.config.ConductorProperties;
import com.bko.conductor.orchestration.OrchestrationRun;
import com.bko.conductor.orchestration.api.OrchestrationListener;
import com.bko.conductor.orchestration.model.InvocationRequest;
import com.bko.conductor.orchestration.model.InvocationResult;
import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.ResearchDepth;
import com.bko.conductor.orchestration.model.RunOptions;
import com.bko.conductor.orchestration.model.TaskPriority;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.bko.conductor.orchestration.model.WaveSettings;
import com.bko.conductor.orchestration.model.WorkerResult;
import com.bko.conductor.orchestration.model.WorkerStatus;
import com.bko.conductor.support.MutableClock;
import com.bko.conductor.support.ScriptedInvocationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.bko.conductor.orchestration.OrchestrationConstants.PURPOSE_RESEARCH_WORKER;
import static com.bko.conductor.orchestration.OrchestrationConstants.PURPOSE_WORKER_RETRY;
import static com.bko.conductor.orchestration.OrchestrationConstants.PURPOSE_WORKER_TASK;
import static org.junit.jupiter.api.Assertions.*;

class WorkerExecutionServiceImplTest {

    private final MutableClock clock = MutableClock.startingAtEpoch();
    private final ConductorProperties properties = new ConductorProperties();
    private final ScriptedInvocationService invocations = new ScriptedInvocationService();
    private ExecutorService executor;
    private FailoverRegistry failoverRegistry;
    private WorkerExecutionServiceImpl service;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        ModelCatalog catalog = new ModelCatalog();
        failoverRegistry = new FailoverRegistry(catalog, clock);
        service = new WorkerExecutionServiceImpl(invocations, failoverRegistry, catalog,
                new OrchestrationPromptService(new SourceExtractionService()), new OrchestrationMetricsService(),
                properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testRunsWaveAndPassesDependencyOutput() {
        invocations.respondWith(request -> InvocationResult.success("answer for " + request.prompt(), 0.01, null, 5L));
        OrchestrationRun run = newRun(RunOptions.commander());
        List<TaskSpec> wave = List.of(
                task("t2", ModelCatalog.SONNET, TaskPriority.STANDARD, List.of("t1")),
                task("t3", ModelCatalog.HAIKU, TaskPriority.STANDARD, List.of()));

        List<WorkerResult> results = service.runWave(run, wave, Map.of("t1", "earlier output"), commanderSettings());

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(result -> result.status() == WorkerStatus.SUCCESS));
        InvocationRequest t2Request = invocations.requests(PURPOSE_WORKER_TASK).stream()
                .filter(request -> request.prompt().endsWith("do t2"))
                .findFirst()
                .orElseThrow();
        assertTrue(t2Request.prompt().contains("[Output from t1]\nearlier output"));
        assertTrue(t2Request.toolsEnabled());
        assertEquals(2, run.results().size());
        assertEquals(0.02, run.totalCost(), 1e-9);
    }

    @Test
    void testCriticalFailureIsRetriedOnceWithSameModelInCommanderMode() {
        AtomicInteger attempts = new AtomicInteger();
        invocations.respondWith(request -> attempts.incrementAndGet() == 1
                ? InvocationResult.error("upstream exploded")
                : InvocationResult.success("recovered", null, null, 5L));
        OrchestrationRun run = newRun(RunOptions.commander());

        List<WorkerResult> results = service.runWave(run,
                List.of(task("t1", ModelCatalog.OPUS, TaskPriority.CRITICAL, List.of())), Map.of(), commanderSettings());

        assertEquals(1, results.size());
        assertEquals(WorkerStatus.SUCCESS, results.get(0).status());
        assertEquals("recovered", results.get(0).content());
        List<InvocationRequest> retries = invocations.requests(PURPOSE_WORKER_RETRY);
        assertEquals(1, retries.size());
        assertEquals(ModelCatalog.OPUS, retries.get(0).model());
    }

    @Test
    void testStandardFailureIsNotRetried() {
        invocations.respondWith(request -> InvocationResult.error("boom"));
        OrchestrationRun run = newRun(RunOptions.commander());

        List<WorkerResult> results = service.runWave(run,
                List.of(task("t1", ModelCatalog.SONNET, TaskPriority.STANDARD, List.of())), Map.of(), commanderSettings());

        assertEquals(WorkerStatus.ERROR, results.get(0).status());
        assertEquals("boom", results.get(0).error());
        assertTrue(invocations.requests(PURPOSE_WORKER_RETRY).isEmpty());
    }

    @Test
    void testPartialCriticalResultIsKeptWithoutRetry() {
        invocations.respondWith(request -> InvocationResult.partial("half an answer", null, 5000L, "Timeout after 5000ms"));
        OrchestrationRun run = newRun(RunOptions.commander());

        List<WorkerResult> results = service.runWave(run,
                List.of(task("t1", ModelCatalog.SONNET, TaskPriority.CRITICAL, List.of())), Map.of(), commanderSettings());

        assertEquals(WorkerStatus.PARTIAL, results.get(0).status());
        assertEquals("half an answer", results.get(0).content());
        assertTrue(invocations.requests(PURPOSE_WORKER_RETRY).isEmpty());
        assertEquals(1, invocations.requests().size());
    }

    @Test
    void testWorkerUsesFailoverAlternativeForCoolingModel() {
        invocations.respondWith(request -> InvocationResult.success("ok", null, null, 5L));
        failoverRegistry.reportFailure(ModelCatalog.SONNET, "429 Too Many Requests");
        OrchestrationRun run = newRun(RunOptions.commander());

        List<WorkerResult> results = service.runWave(run,
                List.of(task("t1", ModelCatalog.SONNET, TaskPriority.STANDARD, List.of())), Map.of(), commanderSettings());

        String expected = failoverRegistry.resolve(ModelCatalog.SONNET);
        assertNotEquals(ModelCatalog.SONNET, expected);
        assertEquals(ModelCatalog.GEMINI_3_FLASH, expected);
        assertEquals(expected, invocations.requests(PURPOSE_WORKER_TASK).get(0).model());
        assertEquals(expected, results.get(0).model());
    }

    @Test
    void testLaunchesAreStaggeredByPosition() {
        Map<String, Long> launchedAt = new ConcurrentHashMap<>();
        long start = System.nanoTime();
        invocations.respondWith(request -> {
            launchedAt.put(request.prompt(), System.nanoTime() - start);
            return InvocationResult.success("ok", null, null, 1L);
        });
        OrchestrationRun run = newRun(RunOptions.commander());
        WaveSettings staggered = new WaveSettings(OrchestrationMode.COMMANDER, 3, Duration.ofMillis(150),
                Duration.ofSeconds(5), null, ModelCatalog.SONNET);

        service.runWave(run, List.of(
                task("t0", ModelCatalog.SONNET, TaskPriority.STANDARD, List.of()),
                task("t1", ModelCatalog.SONNET, TaskPriority.STANDARD, List.of()),
                task("t2", ModelCatalog.SONNET, TaskPriority.STANDARD, List.of())), Map.of(), staggered);

        assertEquals(3, launchedAt.size());
        assertTrue(launchedAt.get("do t1") >= TimeUnit.MILLISECONDS.toNanos(150));
        assertTrue(launchedAt.get("do t2") >= TimeUnit.MILLISECONDS.toNanos(300));
        assertTrue(launchedAt.get("do t0") < launchedAt.get("do t1"));
        assertTrue(launchedAt.get("do t1") < launchedAt.get("do t2"));
    }

    @Test
    void testResearchRetryCrossesProviderAfterNoOutput() {
        invocations.respondWith(request -> PURPOSE_RESEARCH_WORKER.equals(request.purpose())
                ? null
                : InvocationResult.success("found it", null, null, 5L));
        OrchestrationRun run = newRun(RunOptions.research(ResearchDepth.DEEP));

        List<WorkerResult> results = service.runWave(run,
                List.of(task("q1", ModelCatalog.SONNET, TaskPriority.CRITICAL, List.of())), Map.of(), researchSettings());

        assertEquals(ModelCatalog.GEMINI_25_PRO, invocations.requests(PURPOSE_WORKER_RETRY).get(0).model());
        assertEquals(WorkerStatus.SUCCESS, results.get(0).status());
        assertEquals(ModelCatalog.GEMINI_25_PRO, results.get(0).model());
    }

    @Test
    void testResearchRetryUpgradesAfterProviderError() {
        invocations.respondWith(request -> PURPOSE_RESEARCH_WORKER.equals(request.purpose())
                ? InvocationResult.error("model overloaded")
                : InvocationResult.error("still overloaded"));
        OrchestrationRun run = newRun(RunOptions.research(ResearchDepth.DEEP));

        List<WorkerResult> results = service.runWave(run,
                List.of(task("q1", ModelCatalog.GEMINI_25_FLASH, TaskPriority.CRITICAL, List.of())), Map.of(),
                researchSettings());

        assertEquals(ModelCatalog.GEMINI_25_PRO, invocations.requests(PURPOSE_WORKER_RETRY).get(0).model());
        assertEquals("still overloaded", results.get(0).error());
    }

    @Test
    void testCancelledRunLaunchesNothing() {
        invocations.respondWith(request -> InvocationResult.success("x", null, null, 1L));
        OrchestrationRun run = newRun(RunOptions.commander());
        run.cancel(invocations);

        List<WorkerResult> results = service.runWave(run,
                List.of(task("t1", ModelCatalog.SONNET, TaskPriority.CRITICAL, List.of())), Map.of(), commanderSettings());

        assertEquals(WorkerResult.CANCELLED, results.get(0).error());
        assertTrue(invocations.requests().isEmpty());
    }

    @Test
    void testCriticalFailureReport() {
        TaskSpec critical = task("t1", ModelCatalog.SONNET, TaskPriority.CRITICAL, List.of());
        TaskSpec standard = task("t2", ModelCatalog.HAIKU, TaskPriority.STANDARD, List.of());
        WorkerResult partial = new WorkerResult("t1", ModelCatalog.SONNET, WorkerStatus.PARTIAL, "some text",
                null, null, null, "Timed out but 9 chars preserved");

        assertNull(service.criticalFailureReport(List.of(standard), Map.of()));
        assertNull(service.criticalFailureReport(List.of(critical, standard), Map.of("t1", partial)));

        String report = service.criticalFailureReport(List.of(critical, standard),
                Map.of("t1", WorkerResult.failed("t1", ModelCatalog.SONNET, "429 rate limited")));
        assertNotNull(report);
        assertTrue(report.contains("- do t1 (" + ModelCatalog.SONNET + "): error - 429 rate limited"));
        assertFalse(report.contains("t2"));

        String missing = service.criticalFailureReport(List.of(critical), Map.of());
        assertTrue(missing.contains("no result"));

        properties.setStrictCriticalAccounting(true);
        assertNotNull(service.criticalFailureReport(List.of(critical), Map.of("t1", partial)));
    }

    private OrchestrationRun newRun(RunOptions options) {
        return new OrchestrationRun("run-1", "question", options, clock, Duration.ZERO, OrchestrationListener.NONE);
    }

    private static TaskSpec task(String id, String model, TaskPriority priority, List<String> deps) {
        return new TaskSpec(id, "do " + id, model, "do " + id, priority, deps);
    }

    private static WaveSettings commanderSettings() {
        return new WaveSettings(OrchestrationMode.COMMANDER, 4, Duration.ZERO, Duration.ofSeconds(5), null,
                ModelCatalog.SONNET);
    }

    private static WaveSettings researchSettings() {
        return new WaveSettings(OrchestrationMode.RESEARCH, 3, Duration.ZERO, Duration.ofSeconds(5), "research",
                ModelCatalog.SONNET);
    }
}
