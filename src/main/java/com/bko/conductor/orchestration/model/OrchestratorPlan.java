package com.bko.conductor.orchestration.model;

import java.util.ArrayList;
import java.util.List;

public record OrchestratorPlan(
        String reasoning,
        List<TaskSpec> tasks,
        String synthesisHint
) {
    public OrchestratorPlan {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public boolean singleTask() {
        return tasks.size() == 1;
    }

    public List<TaskSpec> criticalTasks() {
        return tasks.stream().filter(TaskSpec::critical).toList();
    }

    public OrchestratorPlan withAdditionalTasks(List<TaskSpec> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<TaskSpec> merged = new ArrayList<>(tasks);
        merged.addAll(extra);
        return new OrchestratorPlan(reasoning, merged, synthesisHint);
    }
}
