package com.bko.conductor.orchestration.service;

import com.bko.conductor.config.ConductorProperties;
import com.bko.conductor.orchestration.OrchestrationRun;
import com.bko.conductor.orchestration.api.ModelInvocationService;
import com.bko.conductor.orchestration.model.GapAnalysis;
import com.bko.conductor.orchestration.model.InvocationRequest;
import com.bko.conductor.orchestration.model.InvocationResult;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.bko.conductor.orchestration.model.WorkerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.bko.conductor.orchestration.OrchestrationConstants.PURPOSE_GAP_CHECK;
import static com.bko.conductor.orchestration.OrchestrationConstants.RESEARCH_GAP_PROMPT;

/**
 * Deep-research reflection: asks the planning model whether the collected findings leave gaps and turns
 * its answer into follow-up tasks that avoid models known to be failing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchReflectionService {

    private final ModelInvocationService invocationService;
    private final PlanParsingService planParsingService;
    private final OrchestrationPromptService promptService;
    private final FailoverRegistry failoverRegistry;
    private final ConductorProperties properties;

    /**
     * @return the analysis, or {@code null} when the gap check failed, was cancelled or answered with
     *         something unrecognizable
     */
    @Nullable
    public GapAnalysis checkGaps(OrchestrationRun run, OrchestratorPlan plan, Collection<WorkerResult> results) {
        String model = properties.getModels().getPlanning();
        InvocationRequest request = InvocationRequest.reasoning(PURPOSE_GAP_CHECK, model, RESEARCH_GAP_PROMPT,
                promptService.gapAnalysisMessage(run.userMessage(), plan, results),
                properties.getTimeouts().getGapCheck());
        InvocationResult result = invocationService.invoke(request, run.signal()).join();
        if (result == null) {
            return null;
        }
        run.addCost(result.cost());
        if (!StringUtils.hasText(result.content())) {
            log.warn("Gap check returned no content: {}", result.firstStderrLine());
            return null;
        }
        GapAnalysis analysis = planParsingService.parseGapAnalysis(result.content(),
                properties.getResearch().getMaxFollowUps(), properties.getModels().getDefaultWorker());
        if (analysis == null) {
            log.warn("Gap check response could not be parsed, skipping follow-ups.");
        } else {
            log.info("Gap check: {} ({} follow-up(s)) - {}", analysis.status(), analysis.followUpTasks().size(),
                    analysis.reasoning());
        }
        return analysis;
    }

    /** Models whose workers produced no output at all in this run. */
    public Set<String> timedOutModels(Collection<WorkerResult> results) {
        Set<String> models = new LinkedHashSet<>();
        for (WorkerResult result : results) {
            if (result.failedWithoutOutput()) {
                models.add(result.model());
            }
        }
        return models;
    }

    /**
     * Reassigns follow-ups away from timed-out or cooling-down models and makes their ids unique against
     * the tasks already in the plan.
     */
    public List<TaskSpec> prepareFollowUps(List<TaskSpec> followUps, Set<String> timedOutModels,
                                           Collection<String> existingIds) {
        Set<String> usedIds = new HashSet<>(existingIds);
        List<TaskSpec> prepared = new ArrayList<>(followUps.size());
        for (TaskSpec task : followUps) {
            TaskSpec adjusted = task;
            if (timedOutModels.contains(task.model()) || !failoverRegistry.isAvailable(task.model())) {
                String replacement = failoverRegistry.resolve(properties.getModels().getFollowUpFallback());
                log.info("Follow-up {} reassigned from {} to {}", task.id(), task.model(), replacement);
                adjusted = adjusted.withModel(replacement);
            }
            String id = uniqueId(adjusted.id(), usedIds);
            usedIds.add(id);
            if (!id.equals(adjusted.id())) {
                adjusted = new TaskSpec(id, adjusted.description(), adjusted.model(), adjusted.prompt(),
                        adjusted.priority(), adjusted.dependsOn());
            }
            prepared.add(adjusted);
        }
        return prepared;
    }

    private static String uniqueId(String id, Set<String> usedIds) {
        if (!usedIds.contains(id)) {
            return id;
        }
        int suffix = 2;
        while (usedIds.contains(id + "-" + suffix)) {
            suffix++;
        }
        return id + "-" + suffix;
    }
}
