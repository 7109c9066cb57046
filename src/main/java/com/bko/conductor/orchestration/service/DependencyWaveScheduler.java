package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.model.TaskSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Partitions tasks into waves by their {@code dependsOn} relationships. Wave 1 holds tasks with no
 * dependencies; each later wave holds tasks whose dependencies all ran in earlier waves.
 *
 * <p>A dependency cycle does not deadlock: once no remaining task is eligible, every remaining task is
 * forced into one final wave.
 */
@Service
@Slf4j
public class DependencyWaveScheduler {

    public List<List<TaskSpec>> resolveWaves(List<TaskSpec> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        if (tasks.stream().noneMatch(TaskSpec::hasDependencies)) {
            return List.of(List.copyOf(tasks));
        }

        Set<String> scheduled = new HashSet<>();
        List<TaskSpec> remaining = new ArrayList<>(tasks);
        List<List<TaskSpec>> waves = new ArrayList<>();
        while (!remaining.isEmpty()) {
            List<TaskSpec> wave = remaining.stream()
                    .filter(task -> scheduled.containsAll(task.dependsOn()))
                    .toList();
            if (wave.isEmpty()) {
                log.warn("Circular or unresolvable dependencies among {}, forcing them into a final wave",
                        remaining.stream().map(TaskSpec::id).toList());
                waves.add(List.copyOf(remaining));
                break;
            }
            waves.add(wave);
            wave.forEach(task -> scheduled.add(task.id()));
            remaining.removeAll(wave);
        }

        log.info("Resolved {} tasks into {} wave(s): {}", tasks.size(), waves.size(), describe(waves));
        return waves;
    }

    static String describe(List<List<TaskSpec>> waves) {
        return IntStream.range(0, waves.size())
                .mapToObj(i -> "W" + (i + 1) + "(" + waves.get(i).size() + ")")
                .collect(Collectors.joining(" -> "));
    }
}
