package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import com.bko.conductor.orchestration.model.ResearchDepth;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.bko.conductor.orchestration.model.WorkerResult;
import com.bko.conductor.orchestration.model.WorkerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.bko.conductor.orchestration.OrchestrationConstants.*;

@Service
@RequiredArgsConstructor
public class OrchestrationPromptService {

    private static final Pattern BUILD_VERB =
            Pattern.compile("\\b(build|create|implement|scaffold|generate|develop|make|set\\s*up|write)\\b");
    private static final Pattern CODE_ARTIFACT = Pattern.compile("\\b(app|application|component|page|feature|project"
            + "|website|site|dashboard|api|service|module|game|tool|system|engine|ui|interface|function|class|library"
            + "|endpoint|route|hook|form|modal|dialog|panel|widget|layout|theme|plugin|server|client|database|schema"
            + "|migration|test|spec)\\b");

    private final SourceExtractionService sourceExtractionService;

    /** A build verb together with a code artifact noun, so "write a poem" is not a build. */
    public boolean isBuildIntent(String message) {
        if (!StringUtils.hasText(message)) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return BUILD_VERB.matcher(lower).find() && CODE_ARTIFACT.matcher(lower).find();
    }

    public String commanderPlanningPrompt(String userMessage) {
        return isBuildIntent(userMessage) ? COMMANDER_BUILD_PLANNING_PROMPT : COMMANDER_PLANNING_PROMPT;
    }

    public String researchPlanningPrompt(ResearchDepth depth, int maxQuestions) {
        String guidance = depth == ResearchDepth.QUICK
                ? RESEARCH_QUICK_COUNT_GUIDANCE
                : RESEARCH_DEEP_COUNT_GUIDANCE.formatted(maxQuestions);
        return RESEARCH_PLANNING_PROMPT.formatted(guidance);
    }

    public String planningMessage(String userMessage, String conversationContext) {
        return contextBlock(conversationContext) + "[User's current message]\n" + userMessage;
    }

    public String researchPlanningMessage(String query, String conversationContext) {
        return contextBlock(conversationContext) + "[Research query]\n" + query;
    }

    public String researchWorkerMessage(String question, String searchQuery) {
        return RESEARCH_WORKER_TEMPLATE.formatted(question, searchQuery);
    }

    /**
     * Prefixes a worker prompt with the output of the tasks it depends on. Dependencies without output
     * are skipped; with none left the prompt is returned unchanged.
     */
    public String workerPromptWithDependencies(TaskSpec task, Map<String, String> priorOutputs, OrchestrationMode mode) {
        if (!task.hasDependencies() || priorOutputs.isEmpty()) {
            return task.prompt();
        }
        String label = mode == OrchestrationMode.RESEARCH ? "[Prior findings from %s]\n" : "[Output from %s]\n";
        List<String> blocks = task.dependsOn().stream()
                .filter(depId -> StringUtils.hasText(priorOutputs.get(depId)))
                .map(depId -> label.formatted(depId) + priorOutputs.get(depId))
                .toList();
        if (blocks.isEmpty()) {
            return task.prompt();
        }
        String joined = String.join(RESULT_DIVIDER, blocks);
        if (mode == OrchestrationMode.RESEARCH) {
            return RESEARCH_DEPENDENCY_HEADER + joined + RESULT_DIVIDER + task.prompt();
        }
        return DEPENDENCY_CONTEXT_HEADER + joined + DEPENDENCY_CONTEXT_FOOTER + task.prompt();
    }

    public String commanderSynthesisMessage(String userMessage, OrchestratorPlan plan, Collection<WorkerResult> results) {
        String formatted = results.stream()
                .map(result -> switch (result.status()) {
                    case SUCCESS -> "## Task %s (%s) - Success\n%s".formatted(result.taskId(), result.model(),
                            result.content());
                    case PARTIAL -> "## Task %s (%s) - Partial (timed out)\n%s".formatted(result.taskId(),
                            result.model(), result.content());
                    case ERROR -> "## Task %s (%s) - FAILED\nError: %s".formatted(result.taskId(), result.model(),
                            Objects.requireNonNullElse(result.error(), "Unknown error"));
                })
                .collect(Collectors.joining(RESULT_DIVIDER));
        return COMMANDER_SYNTHESIS_TEMPLATE.formatted(userMessage, plan.reasoning(), plan.synthesisHint(), formatted);
    }

    public String researchSynthesisMessage(String query, OrchestratorPlan plan, Collection<WorkerResult> results) {
        Map<String, String> questions = plan.tasks().stream()
                .collect(Collectors.toMap(TaskSpec::id, TaskSpec::description, (first, second) -> first));
        String findings = results.stream()
                .filter(WorkerResult::hasUsableContent)
                .map(result -> "## Research on: " + questions.getOrDefault(result.taskId(), result.taskId())
                        + (result.status() == WorkerStatus.PARTIAL ? PARTIAL_TAG : "") + "\n"
                        + sourceExtractionService.cleanWorkerContent(result.content()))
                .collect(Collectors.joining(RESULT_DIVIDER));
        return RESEARCH_SYNTHESIS_TEMPLATE.formatted(query, plan.reasoning(), findings);
    }

    public String gapAnalysisMessage(String query, OrchestratorPlan plan, Collection<WorkerResult> results) {
        String questions = plan.tasks().stream()
                .map(task -> "- " + task.id() + ": " + task.description())
                .collect(Collectors.joining("\n"));
        String findings = results.stream()
                .map(result -> result.hasUsableContent()
                        ? "## " + result.taskId() + "\n" + sourceExtractionService.cleanWorkerContent(result.content())
                        : "## " + result.taskId() + " - FAILED\n"
                                + Objects.requireNonNullElse(result.error(), "No output"))
                .collect(Collectors.joining(RESULT_DIVIDER));
        return GAP_ANALYSIS_TEMPLATE.formatted(query, plan.reasoning(), questions, findings);
    }

    public String qualityCheckMessage(String userQuery, String synthesis) {
        return "USER QUESTION: " + head(userQuery, QUALITY_QUESTION_CHARS)
                + "\n\nRESPONSE TO EVALUATE:\n" + head(synthesis, QUALITY_RESPONSE_CHARS);
    }

    public String revisionMessage(String synthesisMessage, String previousSynthesis, String feedback) {
        return REVISION_TEMPLATE.formatted(synthesisMessage, feedback, head(previousSynthesis, REVISION_PREVIOUS_CHARS));
    }

    private static String contextBlock(String conversationContext) {
        return StringUtils.hasText(conversationContext)
                ? "[Conversation context]\n" + conversationContext + "\n\n"
                : "";
    }

    public static String head(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        return value.length() > maxChars ? value.substring(0, maxChars) : value;
    }
}
