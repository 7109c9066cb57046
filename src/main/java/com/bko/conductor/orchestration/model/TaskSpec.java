package com.bko.conductor.orchestration.model;

import java.util.List;

/**
 * One unit of work assigned to a single worker model.
 *
 * @param id          plan-unique identifier, e.g. {@code task-1} or {@code q3}
 * @param description human readable summary
 * @param model       canonical model id the planner assigned
 * @param prompt      self-contained prompt sent to the worker
 * @param priority    critical tasks gate the run, standard tasks do not
 * @param dependsOn   ids of tasks whose output this task receives as context; never contains its own id
 */
public record TaskSpec(
        String id,
        String description,
        String model,
        String prompt,
        TaskPriority priority,
        List<String> dependsOn
) {
    public TaskSpec {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        priority = priority == null ? TaskPriority.STANDARD : priority;
    }

    public boolean critical() {
        return priority == TaskPriority.CRITICAL;
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    public TaskSpec withModel(String newModel) {
        return new TaskSpec(id, description, newModel, prompt, priority, dependsOn);
    }
}
