package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.model.GapAnalysis;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import com.bko.conductor.orchestration.model.TaskPriority;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.bko.conductor.orchestration.OrchestrationConstants.DEFAULT_SYNTHESIS_HINT;
import static com.bko.conductor.orchestration.OrchestrationConstants.MAX_DESCRIPTION_CHARS;

/**
 * Turns planner output into validated plans. Salvages as much as possible: malformed entries are dropped,
 * unknown model names are corrected, dangling dependencies are stripped and oversized plans are trimmed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanParsingService {

    private final JsonProcessingService jsonProcessingService;
    private final ModelCatalog modelCatalog;
    private final OrchestrationPromptService promptService;

    /**
     * Parses a commander plan.
     *
     * @param raw      planner output
     * @param maxTasks task cap; excess tasks are trimmed keeping critical ones first
     * @param defaultModel model used when a task names none or an unknown one
     * @return the plan, or {@code null} when no valid task survives
     */
    @Nullable
    public OrchestratorPlan parseCommanderPlan(@Nullable String raw, int maxTasks, String defaultModel) {
        JsonNode root = jsonProcessingService.extractJson(raw, JsonProcessingService.TASKS_KEY);
        if (root == null) {
            return null;
        }
        List<JsonNode> entries = trimToCap(arrayEntries(root, JsonProcessingService.TASKS_KEY), maxTasks);
        List<JsonNode> valid = entries.stream()
                .filter(node -> hasText(node, "id") && hasText(node, "prompt"))
                .toList();
        if (valid.size() < entries.size()) {
            log.warn("Dropped {} plan task(s) missing id or prompt.", entries.size() - valid.size());
        }
        if (valid.isEmpty()) {
            log.warn("Plan validation: no valid tasks after filtering.");
            return null;
        }

        Set<String> ids = valid.stream().map(node -> text(node, "id")).collect(Collectors.toSet());
        List<TaskSpec> tasks = new ArrayList<>();
        for (JsonNode node : valid) {
            String id = text(node, "id");
            String prompt = text(node, "prompt");
            String description = hasText(node, "description")
                    ? text(node, "description")
                    : prompt.substring(0, Math.min(prompt.length(), MAX_DESCRIPTION_CHARS));
            tasks.add(new TaskSpec(id, description, commanderModel(text(node, "model"), defaultModel), prompt,
                    TaskPriority.fromLabel(text(node, "priority")), dependencies(node, id, ids)));
        }
        String hint = hasText(root, "synthesisHint") ? text(root, "synthesisHint") : DEFAULT_SYNTHESIS_HINT;
        return new OrchestratorPlan(text(root, "reasoning"), tasks, hint);
    }

    /**
     * Parses a research plan. Each sub-question becomes a task whose prompt is the research worker message
     * built from the question and its search query.
     */
    @Nullable
    public OrchestratorPlan parseResearchPlan(@Nullable String raw, int maxQuestions, String defaultModel) {
        JsonNode root = jsonProcessingService.extractJson(raw, JsonProcessingService.QUESTIONS_KEY);
        if (root == null) {
            return null;
        }
        List<JsonNode> entries = trimToCap(arrayEntries(root, JsonProcessingService.QUESTIONS_KEY), maxQuestions);
        List<JsonNode> valid = entries.stream().filter(PlanParsingService::isValidQuestion).toList();
        if (valid.size() < entries.size()) {
            log.warn("Dropped {} research question(s) missing id, question or searchQuery.",
                    entries.size() - valid.size());
        }
        if (valid.isEmpty()) {
            return null;
        }
        Set<String> ids = valid.stream().map(node -> text(node, "id")).collect(Collectors.toSet());
        List<TaskSpec> tasks = valid.stream()
                .map(node -> toResearchTask(node, defaultModel, dependencies(node, text(node, "id"), ids)))
                .toList();
        return new OrchestratorPlan(text(root, "reasoning"), tasks, "");
    }

    /**
     * Parses a gap-check response. A {@code gaps_found} status without a usable follow-up list is
     * treated as complete.
     *
     * @return the analysis, or {@code null} when the response is not a recognizable verdict
     */
    @Nullable
    public GapAnalysis parseGapAnalysis(@Nullable String raw, int maxFollowUps, String defaultModel) {
        JsonNode root = jsonProcessingService.extractJson(raw, null);
        if (root == null) {
            return null;
        }
        String status = text(root, "status");
        String reasoning = text(root, "reasoning");
        if ("complete".equals(status)) {
            return GapAnalysis.complete(reasoning);
        }
        if (!"gaps_found".equals(status)) {
            return null;
        }
        JsonNode questions = root.get("followUpQuestions");
        if (questions == null || !questions.isArray()) {
            return GapAnalysis.complete("No valid follow-up questions");
        }
        List<TaskSpec> followUps = new ArrayList<>();
        for (JsonNode node : questions) {
            if (isValidQuestion(node) && followUps.size() < maxFollowUps) {
                followUps.add(toResearchTask(node, defaultModel, List.of()));
            }
        }
        if (followUps.isEmpty()) {
            return GapAnalysis.complete("No valid follow-up questions");
        }
        return new GapAnalysis(GapAnalysis.Status.GAPS_FOUND, reasoning, followUps);
    }

    private TaskSpec toResearchTask(JsonNode node, String defaultModel, List<String> dependsOn) {
        String question = text(node, "question");
        String model = text(node, "model");
        if (!modelCatalog.isResearchWorkerModel(model)) {
            if (StringUtils.hasText(model)) {
                log.warn("Unknown research model '{}', using {}.", model, defaultModel);
            }
            model = defaultModel;
        }
        return new TaskSpec(text(node, "id"), question, model,
                promptService.researchWorkerMessage(question, text(node, "searchQuery")),
                TaskPriority.fromLabel(text(node, "priority")), dependsOn);
    }

    private String commanderModel(String requested, String defaultModel) {
        if (!StringUtils.hasText(requested)) {
            return defaultModel;
        }
        String corrected = modelCatalog.correctWorkerModel(requested);
        if (corrected == null) {
            log.warn("Unknown model '{}', defaulting to {}.", requested, defaultModel);
            return defaultModel;
        }
        if (!corrected.equals(requested)) {
            log.warn("Auto-corrected model '{}' -> '{}'.", requested, corrected);
        }
        return corrected;
    }

    /** Keeps the first {@code cap} entries by (critical first, original order), returned in original order. */
    private List<JsonNode> trimToCap(List<JsonNode> entries, int cap) {
        if (entries.size() <= cap) {
            return entries;
        }
        log.warn("Plan has {} entries, trimming to {}.", entries.size(), cap);
        return IntStream.range(0, entries.size())
                .boxed()
                .sorted(Comparator.<Integer>comparingInt(i -> isCritical(entries.get(i)) ? 0 : 1)
                        .thenComparingInt(i -> i))
                .limit(cap)
                .sorted()
                .map(entries::get)
                .toList();
    }

    private static List<String> dependencies(JsonNode node, String selfId, Set<String> knownIds) {
        JsonNode deps = node.get("dependsOn");
        if (deps == null || !deps.isArray()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<String> kept = new ArrayList<>();
        for (JsonNode dep : deps) {
            String depId = dep.asText("");
            if (knownIds.contains(depId) && !depId.equals(selfId) && seen.add(depId)) {
                kept.add(depId);
            }
        }
        return kept;
    }

    private static List<JsonNode> arrayEntries(JsonNode root, String key) {
        JsonNode array = root.get(key);
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<JsonNode> entries = new ArrayList<>();
        array.forEach(entry -> {
            if (entry.isObject()) {
                entries.add(entry);
            }
        });
        return entries;
    }

    private static boolean isValidQuestion(JsonNode node) {
        return node.isObject() && hasText(node, "id") && hasText(node, "question") && hasText(node, "searchQuery");
    }

    private static boolean isCritical(JsonNode node) {
        return TaskPriority.fromLabel(text(node, "priority")) == TaskPriority.CRITICAL;
    }

    private static boolean hasText(JsonNode node, String field) {
        return StringUtils.hasText(text(node, field));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : "";
    }
}
