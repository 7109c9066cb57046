package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.OrchestrationConstants;
import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import com.bko.conductor.orchestration.model.ResearchDepth;
import com.bko.conductor.orchestration.model.TaskPriority;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.bko.conductor.orchestration.model.WorkerResult;
import com.bko.conductor.orchestration.model.WorkerStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationPromptServiceTest {

    private final OrchestrationPromptService service = new OrchestrationPromptService(new SourceExtractionService());

    @Test
    void testBuildIntentNeedsVerbAndArtifact() {
        assertTrue(service.isBuildIntent("Build a todo app with React"));
        assertTrue(service.isBuildIntent("please implement a REST endpoint for users"));
        assertFalse(service.isBuildIntent("Write a poem about autumn"));
        assertFalse(service.isBuildIntent("Explain how a database index works"));
        assertSame(OrchestrationConstants.COMMANDER_BUILD_PLANNING_PROMPT,
                service.commanderPlanningPrompt("Create a dashboard component"));
        assertSame(OrchestrationConstants.COMMANDER_PLANNING_PROMPT,
                service.commanderPlanningPrompt("Compare two novels"));
    }

    @Test
    void testResearchPlanningPromptCarriesCountGuidance() {
        assertTrue(service.researchPlanningPrompt(ResearchDepth.QUICK, 4)
                .contains(OrchestrationConstants.RESEARCH_QUICK_COUNT_GUIDANCE));
        assertTrue(service.researchPlanningPrompt(ResearchDepth.DEEP, 15).contains("15"));
    }

    @Test
    void testPlanningMessageIncludesContextBlockOnlyWhenPresent() {
        assertEquals("[User's current message]\nhello", service.planningMessage("hello", ""));
        assertEquals("[Conversation context]\nUser: hi\n\n[User's current message]\nhello",
                service.planningMessage("hello", "User: hi"));
        assertTrue(service.researchPlanningMessage("topic", "").startsWith("[Research query]"));
    }

    @Test
    void testDependencyOutputsArePrefixed() {
        TaskSpec task = new TaskSpec("t2", "write", ModelCatalog.SONNET, "Write the summary",
                TaskPriority.STANDARD, List.of("t1", "t0"));

        String prompt = service.workerPromptWithDependencies(task, Map.of("t1", "facts here"),
                OrchestrationMode.COMMANDER);

        assertTrue(prompt.startsWith(OrchestrationConstants.DEPENDENCY_CONTEXT_HEADER));
        assertTrue(prompt.contains("[Output from t1]\nfacts here"));
        assertFalse(prompt.contains("t0"));
        assertTrue(prompt.endsWith("Now complete your task:\nWrite the summary"));
    }

    @Test
    void testResearchDependencyLabel() {
        TaskSpec task = new TaskSpec("q2", "q", ModelCatalog.SONNET, "Research more",
                TaskPriority.STANDARD, List.of("q1"));

        String prompt = service.workerPromptWithDependencies(task, Map.of("q1", "found"), OrchestrationMode.RESEARCH);

        assertTrue(prompt.contains("[Prior findings from q1]\nfound"));
        assertTrue(prompt.endsWith("Research more"));
    }

    @Test
    void testPromptUnchangedWithoutDependencyOutput() {
        TaskSpec task = new TaskSpec("t2", "write", ModelCatalog.SONNET, "Write", TaskPriority.STANDARD, List.of("t1"));
        assertEquals("Write", service.workerPromptWithDependencies(task, Map.of(), OrchestrationMode.COMMANDER));
    }

    @Test
    void testCommanderSynthesisMarksEachResult() {
        OrchestratorPlan plan = new OrchestratorPlan("why", List.of(), "Combine");
        List<WorkerResult> results = List.of(
                new WorkerResult("t1", "m1", WorkerStatus.SUCCESS, "ok text", null, null, null, null),
                new WorkerResult("t2", "m2", WorkerStatus.PARTIAL, "half", null, null, null, "Timed out"),
                WorkerResult.failed("t3", "m3", "429 Too Many Requests"));

        String message = service.commanderSynthesisMessage("question", plan, results);

        assertTrue(message.contains("## Task t1 (m1) - Success\nok text"));
        assertTrue(message.contains("## Task t2 (m2) - Partial (timed out)\nhalf"));
        assertTrue(message.contains("## Task t3 (m3) - FAILED\nError: 429 Too Many Requests"));
        assertTrue(message.contains("Synthesis instructions: Combine"));
    }

    @Test
    void testRevisionMessageContainsAllParts() {
        String message = service.revisionMessage("ORIGINAL PROMPT", "previous answer", "missing section X");

        assertTrue(message.startsWith("ORIGINAL PROMPT"));
        assertTrue(message.contains("missing section X"));
        assertTrue(message.contains("previous answer"));
    }

    @Test
    void testQualityMessageIsClipped() {
        String message = service.qualityCheckMessage("q".repeat(600), "r".repeat(5000));
        assertTrue(message.contains("q".repeat(500)));
        assertFalse(message.contains("q".repeat(501)));
        assertFalse(message.contains("r".repeat(4001)));
    }
}
