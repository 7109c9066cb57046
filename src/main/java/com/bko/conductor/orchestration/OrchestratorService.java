package com.bko.conductor.orchestration;

import static com.bko.conductor.orchestration.OrchestrationConstants.*;

import com.bko.conductor.config.ConductorProperties;
import com.bko.conductor.orchestration.api.ModelInvocationService;
import com.bko.conductor.orchestration.api.OrchestrationListener;
import com.bko.conductor.orchestration.api.WorkerExecutionService;
import com.bko.conductor.orchestration.model.ControlOutcome;
import com.bko.conductor.orchestration.model.GapAnalysis;
import com.bko.conductor.orchestration.model.InvocationRequest;
import com.bko.conductor.orchestration.model.InvocationResult;
import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.OrchestrationPhase;
import com.bko.conductor.orchestration.model.OrchestrationResult;
import com.bko.conductor.orchestration.model.OrchestrationSnapshot;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import com.bko.conductor.orchestration.model.QualityCheckResult;
import com.bko.conductor.orchestration.model.RunOptions;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.bko.conductor.orchestration.model.WaveSettings;
import com.bko.conductor.orchestration.model.WorkerResult;
import com.bko.conductor.orchestration.model.WorkerStatus;
import com.bko.conductor.orchestration.service.DependencyWaveScheduler;
import com.bko.conductor.orchestration.service.OrchestrationContextService;
import com.bko.conductor.orchestration.service.OrchestrationMetricsService;
import com.bko.conductor.orchestration.service.OrchestrationPromptService;
import com.bko.conductor.orchestration.service.PlanParsingService;
import com.bko.conductor.orchestration.service.QualityGateService;
import com.bko.conductor.orchestration.service.ResearchReflectionService;
import com.bko.conductor.orchestration.service.SourceExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Drives a run through planning, review, execution, reflection, synthesis and quality revision.
 * Each run executes on the orchestration executor; workers fan out onto the worker executor.
 */
@Service
@Slf4j
public class OrchestratorService {

    static final Duration RUN_RETENTION = Duration.ofMinutes(30);

    private final ModelInvocationService invocationService;
    private final WorkerExecutionService workerExecutionService;
    private final PlanParsingService planParsingService;
    private final DependencyWaveScheduler waveScheduler;
    private final QualityGateService qualityGateService;
    private final ResearchReflectionService reflectionService;
    private final OrchestrationPromptService promptService;
    private final OrchestrationContextService contextService;
    private final SourceExtractionService sourceExtractionService;
    private final OrchestrationMetricsService metricsService;
    private final ConductorProperties properties;
    private final ExecutorService orchestrationExecutor;
    private final Clock clock;
    private final Map<String, OrchestrationRun> runs = new ConcurrentHashMap<>();
    private final Map<String, Instant> finishedAt = new ConcurrentHashMap<>();

    public OrchestratorService(
            ModelInvocationService invocationService,
            WorkerExecutionService workerExecutionService,
            PlanParsingService planParsingService,
            DependencyWaveScheduler waveScheduler,
            QualityGateService qualityGateService,
            ResearchReflectionService reflectionService,
            OrchestrationPromptService promptService,
            OrchestrationContextService contextService,
            SourceExtractionService sourceExtractionService,
            OrchestrationMetricsService metricsService,
            ConductorProperties properties,
            @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor,
            Clock clock) {
        this.invocationService = invocationService;
        this.workerExecutionService = workerExecutionService;
        this.planParsingService = planParsingService;
        this.waveScheduler = waveScheduler;
        this.qualityGateService = qualityGateService;
        this.reflectionService = reflectionService;
        this.promptService = promptService;
        this.contextService = contextService;
        this.sourceExtractionService = sourceExtractionService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.orchestrationExecutor = orchestrationExecutor;
        this.clock = clock;
    }

    /**
     * Registers a run and starts it on the orchestration executor.
     *
     * @return the run, already registered so control requests can reach it
     */
    public OrchestrationRun startRun(String runId, String userMessage, RunOptions options,
                                     OrchestrationListener listener) {
        OrchestrationRun run = register(runId, userMessage, options, listener);
        orchestrationExecutor.execute(() -> execute(run));
        return run;
    }

    /** Runs to completion on the calling thread with the review gate skipped. */
    public OrchestrationResult run(String userMessage, RunOptions options) {
        OrchestrationRun run = register(UUID.randomUUID().toString(), userMessage, options.withAutoApprove(),
                OrchestrationListener.NONE);
        execute(run);
        return run.completion().join();
    }

    public ControlOutcome approve(String runId) {
        OrchestrationRun run = runs.get(runId);
        if (run == null) {
            return ControlOutcome.NOT_FOUND;
        }
        return run.approve() ? ControlOutcome.APPLIED : ControlOutcome.CONFLICT;
    }

    public ControlOutcome reject(String runId) {
        OrchestrationRun run = runs.get(runId);
        if (run == null) {
            return ControlOutcome.NOT_FOUND;
        }
        return run.reject(invocationService) ? ControlOutcome.APPLIED : ControlOutcome.CONFLICT;
    }

    /**
     * Cancels a run. Repeated calls, and calls after the run finished, are accepted and do nothing.
     *
     * @return {@code false} only when the run is unknown
     */
    public boolean cancel(String runId) {
        OrchestrationRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        run.cancel(invocationService);
        return true;
    }

    public Optional<OrchestrationSnapshot> snapshot(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(OrchestrationRun::snapshot);
    }

    private OrchestrationRun register(String runId, String userMessage, RunOptions options,
                                      OrchestrationListener listener) {
        cleanupFinishedRuns();
        OrchestrationRun run = new OrchestrationRun(runId, userMessage, options, clock,
                properties.getStreamThrottle(), listener);
        runs.put(runId, run);
        run.completion().whenComplete((result, error) -> finishedAt.put(runId, clock.instant()));
        return run;
    }

    private void cleanupFinishedRuns() {
        Instant cutoff = clock.instant().minus(RUN_RETENTION);
        finishedAt.entrySet().removeIf(entry -> {
            if (entry.getValue().isBefore(cutoff)) {
                runs.remove(entry.getKey());
                return true;
            }
            return false;
        });
    }

    void execute(OrchestrationRun run) {
        RunMdc.setRun(run.runId());
        try {
            run.begin();
            orchestrate(run);
        } catch (Exception ex) {
            if (run.isCancelled()) {
                failCancelled(run);
            } else {
                String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                log.error("Run {} failed in phase {}", run.runId(), run.phase().label(), ex);
                run.fail(UNEXPECTED_PHASE_ERROR.formatted(run.phase().label(), message));
            }
        } finally {
            metricsService.logSummary();
            RunMdc.clear();
        }
    }

    private void orchestrate(OrchestrationRun run) {
        OrchestratorPlan plan = plan(run);
        if (plan == null) {
            return;
        }
        run.setPlan(plan);

        if (requiresReview(run, plan)) {
            boolean approved = run.openReviewGate().join();
            if (!approved) {
                failCancelled(run);
                return;
            }
        }

        run.transition(OrchestrationPhase.EXECUTING);
        Map<String, String> outputs = new LinkedHashMap<>();
        executeTasks(run, plan.tasks(), outputs);
        if (run.isCancelled()) {
            failCancelled(run);
            return;
        }
        String criticalFailure = workerExecutionService.criticalFailureReport(plan.tasks(), run.results());
        if (criticalFailure != null) {
            run.fail(criticalFailure);
            return;
        }

        if (run.options().deepResearch()) {
            plan = reflect(run, plan, outputs);
            if (run.isCancelled()) {
                failCancelled(run);
                return;
            }
        }

        Map<String, WorkerResult> results = run.results();
        if (plan.singleTask()) {
            WorkerResult only = results.get(plan.tasks().get(0).id());
            if (only != null && only.status() == WorkerStatus.SUCCESS && StringUtils.hasText(only.content())) {
                log.info("Single task succeeded, returning its output without synthesis.");
                run.finish(only.content());
                return;
            }
        }

        synthesize(run, plan, results);
    }

    @Nullable
    private OrchestratorPlan plan(OrchestrationRun run) {
        RunOptions options = run.options();
        boolean research = options.research();
        String model = properties.getModels().getPlanning();
        Duration timeout = research ? properties.getTimeouts().getResearchPlanning() : properties.getTimeouts().getPlanning();
        int maxTasks = maxTasks(options);
        String systemPrompt;
        String message;
        if (research) {
            systemPrompt = promptService.researchPlanningPrompt(options.depth(), maxTasks);
            message = promptService.researchPlanningMessage(run.userMessage(),
                    contextService.conversationContext(options.history(), MAX_RESEARCH_CONTEXT_MESSAGES));
        } else {
            systemPrompt = promptService.commanderPlanningPrompt(run.userMessage());
            message = promptService.planningMessage(run.userMessage(),
                    contextService.conversationContext(options.history(), MAX_CONTEXT_MESSAGES));
        }

        InvocationRequest request = InvocationRequest
                .reasoning(research ? PURPOSE_RESEARCH_PLAN : PURPOSE_PLAN, model, systemPrompt, message, timeout)
                .withStreaming(run::planningStreaming);
        InvocationResult result = invoke(run, request);
        if (result != null && !StringUtils.hasText(result.content()) && !run.isCancelled()) {
            log.warn("Planning returned no output ({}), retrying once.", result.firstStderrLine());
            result = invoke(run, new InvocationRequest(research ? PURPOSE_RESEARCH_PLAN_RETRY : PURPOSE_PLAN_RETRY,
                    model, systemPrompt, message, false, 1, timeout, run::planningStreaming));
        }
        if (result == null || run.isCancelled()) {
            failCancelled(run);
            return null;
        }
        if (!StringUtils.hasText(result.content())) {
            String detail = result.firstStderrLine();
            if (!StringUtils.hasText(detail) || detail.contains("no output")) {
                run.fail(PLANNING_NO_OUTPUT_ERROR.formatted(model, timeout.toSeconds()));
            } else {
                run.fail(PLANNING_INVOCATION_ERROR.formatted(model, detail));
            }
            return null;
        }

        String defaultModel = StringUtils.hasText(options.preferredModel())
                ? options.preferredModel()
                : properties.getModels().getDefaultWorker();
        OrchestratorPlan plan = research
                ? planParsingService.parseResearchPlan(result.content(), maxTasks, defaultModel)
                : planParsingService.parseCommanderPlan(result.content(), maxTasks, defaultModel);
        metricsService.recordPlanResponse(research ? PURPOSE_RESEARCH_PLAN : PURPOSE_PLAN, plan);
        if (plan == null) {
            run.fail(PLANNING_PARSE_ERROR.formatted(model,
                    OrchestrationPromptService.head(result.content(), RAW_OUTPUT_EXCERPT_CHARS)));
            return null;
        }
        log.info("Plan ready: {} task(s). Reasoning: {}", plan.tasks().size(), plan.reasoning());
        return plan;
    }

    private boolean requiresReview(OrchestrationRun run, OrchestratorPlan plan) {
        RunOptions options = run.options();
        return plan.tasks().size() > 1 && !options.quickResearch() && !options.autoApprove();
    }

    private void executeTasks(OrchestrationRun run, List<TaskSpec> tasks, Map<String, String> outputs) {
        WaveSettings settings = waveSettings(run.options());
        List<List<TaskSpec>> waves = waveScheduler.resolveWaves(tasks);
        for (int i = 0; i < waves.size(); i++) {
            if (run.isCancelled()) {
                return;
            }
            log.info("Starting wave {}/{} with {} task(s)", i + 1, waves.size(), waves.get(i).size());
            List<WorkerResult> results = workerExecutionService.runWave(run, waves.get(i), Map.copyOf(outputs),
                    settings);
            contextService.collectUsableOutputs(results, outputs);
            if (run.options().research()) {
                run.addSources(sourceExtractionService.extractSources(results.stream()
                        .filter(WorkerResult::hasUsableContent)
                        .map(WorkerResult::content)
                        .toList()));
            }
        }
    }

    private OrchestratorPlan reflect(OrchestrationRun run, OrchestratorPlan plan, Map<String, String> outputs) {
        run.transition(OrchestrationPhase.GAP_CHECK);
        GapAnalysis analysis = reflectionService.checkGaps(run, plan, run.results().values());
        if (run.isCancelled() || analysis == null || !analysis.hasGaps()) {
            return plan;
        }
        List<TaskSpec> followUps = reflectionService.prepareFollowUps(analysis.followUpTasks(),
                reflectionService.timedOutModels(run.results().values()),
                plan.tasks().stream().map(TaskSpec::id).toList());
        run.transition(OrchestrationPhase.FOLLOW_UP);
        run.addFollowUps(followUps);
        OrchestratorPlan extended = plan.withAdditionalTasks(followUps);
        run.setPlan(extended);
        executeTasks(run, followUps, outputs);
        return extended;
    }

    private void synthesize(OrchestrationRun run, OrchestratorPlan plan, Map<String, WorkerResult> results) {
        boolean research = run.options().research();
        run.transition(OrchestrationPhase.SYNTHESIZING);
        String model = research ? properties.getModels().getResearchSynthesis() : properties.getModels().getSynthesis();
        Duration timeout = research
                ? properties.getTimeouts().getResearchSynthesis()
                : properties.getTimeouts().getSynthesis();
        String systemPrompt = research ? RESEARCH_SYNTHESIS_PROMPT : COMMANDER_SYNTHESIS_PROMPT;
        String synthesisMessage = research
                ? promptService.researchSynthesisMessage(run.userMessage(), plan, results.values())
                : promptService.commanderSynthesisMessage(run.userMessage(), plan, results.values());

        String content = invokeForText(run, PURPOSE_SYNTHESIS, model, systemPrompt, synthesisMessage, timeout,
                run::synthesisStreaming);
        if (run.isCancelled()) {
            failCancelled(run);
            return;
        }
        if (content == null) {
            log.warn("Synthesis produced no output, falling back to concatenated worker results.");
            String fallback = contextService.fallbackContent(results.values(), research);
            run.finish(StringUtils.hasText(fallback) ? fallback : ALL_FAILED_MESSAGE);
            return;
        }

        QualityCheckResult verdict = qualityGateService.checkQuality(run.userMessage(), content, run.signal());
        if (run.isCancelled()) {
            failCancelled(run);
            return;
        }
        if (verdict != null) {
            run.addCost(QUALITY_CHECK_COST);
            log.info("Quality gate: score {}/10 ({})", verdict.score(), verdict.pass() ? "pass" : "fail");
            if (!verdict.pass()) {
                run.transition(OrchestrationPhase.REVISION);
                String revised = invokeForText(run, PURPOSE_REVISION, model, systemPrompt,
                        promptService.revisionMessage(synthesisMessage, content,
                                qualityGateService.revisionFeedback(verdict)),
                        timeout, run::synthesisStreaming);
                if (run.isCancelled()) {
                    failCancelled(run);
                    return;
                }
                if (revised != null) {
                    content = revised;
                } else {
                    log.warn("Revision produced no output, keeping the original synthesis.");
                }
            }
        }

        if (research) {
            run.addSources(sourceExtractionService.extractSources(content));
        }
        run.finish(content);
    }

    @Nullable
    private String invokeForText(OrchestrationRun run, String purpose, String model, String systemPrompt,
                                 String message, Duration timeout, Consumer<String> onStreamingText) {
        InvocationRequest request = InvocationRequest.reasoning(purpose, model, systemPrompt, message, timeout)
                .withStreaming(onStreamingText);
        InvocationResult result = invoke(run, request);
        if (result == null) {
            return null;
        }
        run.addCost(result.cost());
        if (!StringUtils.hasText(result.content())) {
            log.warn("{} via {} returned no content: {}", purpose, model, result.firstStderrLine());
            return null;
        }
        return result.content();
    }

    @Nullable
    private InvocationResult invoke(OrchestrationRun run, InvocationRequest request) {
        return invocationService.invoke(request, run.signal()).join();
    }

    private void failCancelled(OrchestrationRun run) {
        if (run.wasRejected()) {
            run.fail(REJECTED_ERROR);
            return;
        }
        OrchestrationPhase during = run.cancelledDuring() != null ? run.cancelledDuring() : run.phase();
        run.fail(CANCELLED_ERROR.formatted(during.label()));
    }

    private int maxTasks(RunOptions options) {
        if (!options.research()) {
            return properties.getMaxTasks();
        }
        return options.quickResearch()
                ? properties.getResearch().getQuickMaxQuestions()
                : properties.getResearch().getDeepMaxQuestions();
    }

    private WaveSettings waveSettings(RunOptions options) {
        if (options.mode() == OrchestrationMode.RESEARCH) {
            return new WaveSettings(OrchestrationMode.RESEARCH, properties.getResearchConcurrency(),
                    properties.getStagger(), properties.getTimeouts().getResearchWorker(), RESEARCH_WORKER_PROMPT,
                    properties.getModels().getDefaultWorker());
        }
        String defaultModel = StringUtils.hasText(options.preferredModel())
                ? options.preferredModel()
                : properties.getModels().getDefaultWorker();
        return new WaveSettings(OrchestrationMode.COMMANDER, properties.getWorkerConcurrency(),
                properties.getStagger(), properties.getTimeouts().getWorker(), null, defaultModel);
    }
}
