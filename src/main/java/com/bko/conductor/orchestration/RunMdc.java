package com.bko.conductor.orchestration;

import org.slf4j.MDC;

/**
 * MDC keys attached to every log line written on behalf of a run.
 */
public final class RunMdc {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";

    private RunMdc() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String runId, String taskId) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_ID, taskId);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_ID);
    }
}
