package com.bko.conductor.orchestration.model;

import java.util.List;

public record GapAnalysis(
        Status status,
        String reasoning,
        List<TaskSpec> followUpTasks
) {
    public enum Status {
        COMPLETE,
        GAPS_FOUND
    }

    public GapAnalysis {
        followUpTasks = followUpTasks == null ? List.of() : List.copyOf(followUpTasks);
    }

    public static GapAnalysis complete(String reasoning) {
        return new GapAnalysis(Status.COMPLETE, reasoning, List.of());
    }

    public boolean hasGaps() {
        return status == Status.GAPS_FOUND && !followUpTasks.isEmpty();
    }
}
