package com.bko.conductor.orchestration.api;

import com.bko.conductor.orchestration.OrchestrationRun;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.bko.conductor.orchestration.model.WaveSettings;
import com.bko.conductor.orchestration.model.WorkerResult;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Service interface for executing waves of worker tasks.
 */
public interface WorkerExecutionService {

    /**
     * Runs one wave concurrently and blocks until every task has settled. Critical tasks that end in
     * {@code error} are retried once before returning; partial results are kept as they are.
     *
     * @param run The run whose state receives each result as it arrives.
     * @param wave Tasks with no unresolved dependencies among themselves.
     * @param priorOutputs Usable outputs of earlier waves keyed by task id.
     * @param settings Concurrency, stagger, timeout and prompt settings for the wave.
     * @return One result per task in wave order, retries superseding the first attempt.
     */
    List<WorkerResult> runWave(OrchestrationRun run,
                               List<TaskSpec> wave,
                               Map<String, String> priorOutputs,
                               WaveSettings settings);

    /**
     * Reports whether every critical task lacks usable content.
     *
     * @param tasks The tasks to check.
     * @param results Results keyed by task id.
     * @return A per-task failure report, or {@code null} if at least one critical task produced usable
     *         content or there are no critical tasks.
     */
    @Nullable
    String criticalFailureReport(Collection<TaskSpec> tasks, Map<String, WorkerResult> results);
}
