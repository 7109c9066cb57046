package com.bko.conductor.orchestration.service;

import com.bko.conductor.orchestration.model.GapAnalysis;
import com.bko.conductor.orchestration.model.OrchestratorPlan;
import com.bko.conductor.orchestration.model.TaskPriority;
import com.bko.conductor.orchestration.model.TaskSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PlanParsingServiceTest {

    private final SourceExtractionService sourceExtractionService = new SourceExtractionService();
    private final PlanParsingService service = new PlanParsingService(
            new JsonProcessingService(new ObjectMapper()),
            new ModelCatalog(),
            new OrchestrationPromptService(sourceExtractionService));

    @Test
    void testParsesValidPlanUnchanged() {
        String raw = """
                {"reasoning": "two parts", "tasks": [
                  {"id": "task-1", "description": "Research", "model": "claude-sonnet-4-6", "prompt": "Find facts", "priority": "critical"},
                  {"id": "task-2", "description": "Write", "model": "gemini-2.5-pro", "prompt": "Write it up", "dependsOn": ["task-1"]}
                ], "synthesisHint": "Combine"}""";

        OrchestratorPlan plan = service.parseCommanderPlan(raw, 7, ModelCatalog.SONNET);

        assertNotNull(plan);
        assertEquals(2, plan.tasks().size());
        assertEquals("Combine", plan.synthesisHint());
        assertEquals(TaskPriority.CRITICAL, plan.tasks().get(0).priority());
        assertEquals(List.of("task-1"), plan.tasks().get(1).dependsOn());
        assertEquals(ModelCatalog.GEMINI_25_PRO, plan.tasks().get(1).model());
    }

    @Test
    void testParsesPlanWhosePromptContainsCodeFence() {
        String raw = "{\"reasoning\":\"r\",\"tasks\":[{\"id\":\"t1\",\"prompt\":\"Return a ```ts code``` block\","
                + "\"priority\":\"critical\"}],\"synthesisHint\":\"h\"}";

        OrchestratorPlan plan = service.parseCommanderPlan(raw, 7, ModelCatalog.SONNET);

        assertNotNull(plan);
        assertEquals("Return a ```ts code``` block", plan.tasks().get(0).prompt());
        assertEquals("h", plan.synthesisHint());
    }

    @Test
    void testParsesFencedPlanWithInnerFence() {
        String raw = """
                ```json
                {"reasoning": "r", "tasks": [
                  {"id": "t1", "prompt": "Run ```bash\\nnpm test\\n``` and report", "priority": "critical"},
                  {"id": "t2", "prompt": "Summarize", "dependsOn": ["t1"]}
                ], "synthesisHint": "h"}
                ```""";

        OrchestratorPlan plan = service.parseCommanderPlan(raw, 7, ModelCatalog.SONNET);

        assertNotNull(plan);
        assertEquals(2, plan.tasks().size());
        assertTrue(plan.tasks().get(0).prompt().startsWith("Run ```bash\n"));
        assertEquals(List.of("t1"), plan.tasks().get(1).dependsOn());
    }

    @Test
    void testTrimsToCapKeepingCriticalTask() {
        String tasks = IntStream.rangeClosed(1, 9)
                .mapToObj(i -> "{\"id\": \"task-%d\", \"prompt\": \"p%d\", \"priority\": \"%s\"}"
                        .formatted(i, i, i == 9 ? "critical" : "standard"))
                .collect(Collectors.joining(","));
        String raw = "{\"reasoning\": \"many\", \"tasks\": [" + tasks + "]}";

        OrchestratorPlan plan = service.parseCommanderPlan(raw, 7, ModelCatalog.SONNET);

        assertNotNull(plan);
        assertEquals(7, plan.tasks().size());
        List<String> ids = plan.tasks().stream().map(TaskSpec::id).toList();
        assertTrue(ids.contains("task-9"));
        assertEquals(List.of("task-1", "task-2", "task-3", "task-4", "task-5", "task-6", "task-9"), ids);
    }

    @Test
    void testDropsInvalidTasksAndDependencies() {
        String raw = """
                {"tasks": [
                  {"id": "task-1", "prompt": "ok", "dependsOn": ["task-1", "ghost", "task-2"]},
                  {"id": "task-2", "prompt": ""},
                  {"prompt": "no id"},
                  {"id": "task-3", "prompt": "also ok", "dependsOn": ["task-1"]}
                ]}""";

        OrchestratorPlan plan = service.parseCommanderPlan(raw, 7, ModelCatalog.SONNET);

        assertNotNull(plan);
        assertEquals(List.of("task-1", "task-3"), plan.tasks().stream().map(TaskSpec::id).toList());
        assertTrue(plan.tasks().get(0).dependsOn().isEmpty());
        assertEquals(List.of("task-1"), plan.tasks().get(1).dependsOn());
        assertEquals("Merge all results into a coherent response.", plan.synthesisHint());
    }

    @Test
    void testCorrectsLooseModelNamesAndFallsBack() {
        String raw = """
                {"tasks": [
                  {"id": "a", "prompt": "x", "model": "Claude Opus"},
                  {"id": "b", "prompt": "y", "model": "gpt-4o"},
                  {"id": "c", "prompt": "z"}
                ]}""";

        OrchestratorPlan plan = service.parseCommanderPlan(raw, 7, ModelCatalog.HAIKU);

        assertNotNull(plan);
        assertEquals(ModelCatalog.OPUS, plan.tasks().get(0).model());
        assertEquals(ModelCatalog.HAIKU, plan.tasks().get(1).model());
        assertEquals(ModelCatalog.HAIKU, plan.tasks().get(2).model());
    }

    @Test
    void testDescriptionDefaultsToPromptHead() {
        String prompt = "x".repeat(120);
        String raw = "{\"tasks\": [{\"id\": \"a\", \"prompt\": \"" + prompt + "\"}]}";

        OrchestratorPlan plan = service.parseCommanderPlan(raw, 7, ModelCatalog.SONNET);

        assertNotNull(plan);
        assertEquals(80, plan.tasks().get(0).description().length());
    }

    @Test
    void testRecoversTasksFromTruncatedOutput() {
        String raw = """
                ```json
                {"reasoning": "long", "tasks": [
                  {"id": "task-1", "prompt": "complete one", "priority": "critical"},
                  {"id": "task-2", "prompt": "this prompt was cut off in the mid""";

        OrchestratorPlan plan = service.parseCommanderPlan(raw, 7, ModelCatalog.SONNET);

        assertNotNull(plan);
        assertEquals(1, plan.tasks().size());
        assertEquals("task-1", plan.tasks().get(0).id());
    }

    @Test
    void testReturnsNullWhenTruncatedBeforeAnyTaskCloses() {
        String raw = "{\"reasoning\": \"long\", \"tasks\": [{\"id\": \"task-1\", \"prompt\": \"cut";
        assertNull(service.parseCommanderPlan(raw, 7, ModelCatalog.SONNET));
    }

    @Test
    void testReturnsNullForGarbage() {
        assertNull(service.parseCommanderPlan("I could not make a plan.", 7, ModelCatalog.SONNET));
        assertNull(service.parseCommanderPlan("{\"tasks\": []}", 7, ModelCatalog.SONNET));
    }

    @Test
    void testParsesResearchPlan() {
        String raw = """
                {"reasoning": "angles", "questions": [
                  {"id": "q1", "question": "What is X?", "searchQuery": "X definition", "model": "gemini-2.5-flash", "priority": "critical"},
                  {"id": "q2", "question": "Who uses X?", "searchQuery": "X adoption", "model": "unknown-model", "dependsOn": ["q1"]},
                  {"id": "q3", "question": "Missing query"}
                ]}""";

        OrchestratorPlan plan = service.parseResearchPlan(raw, 4, ModelCatalog.SONNET);

        assertNotNull(plan);
        assertEquals(2, plan.tasks().size());
        TaskSpec first = plan.tasks().get(0);
        assertEquals("What is X?", first.description());
        assertEquals(ModelCatalog.GEMINI_25_FLASH, first.model());
        assertTrue(first.prompt().contains("What is X?"));
        assertTrue(first.prompt().contains("X definition"));
        assertEquals(ModelCatalog.SONNET, plan.tasks().get(1).model());
        assertEquals(List.of("q1"), plan.tasks().get(1).dependsOn());
    }

    @Test
    void testGapAnalysisComplete() {
        GapAnalysis analysis = service.parseGapAnalysis(
                "{\"status\": \"complete\", \"reasoning\": \"covered\"}", 3, ModelCatalog.SONNET);
        assertNotNull(analysis);
        assertEquals(GapAnalysis.Status.COMPLETE, analysis.status());
        assertFalse(analysis.hasGaps());
    }

    @Test
    void testGapAnalysisCapsFollowUps() {
        String questions = IntStream.rangeClosed(1, 5)
                .mapToObj(i -> "{\"id\": \"f%d\", \"question\": \"Q%d\", \"searchQuery\": \"s%d\"}".formatted(i, i, i))
                .collect(Collectors.joining(","));
        String raw = "{\"status\": \"gaps_found\", \"reasoning\": \"thin\", \"followUpQuestions\": [" + questions + "]}";

        GapAnalysis analysis = service.parseGapAnalysis(raw, 3, ModelCatalog.SONNET);

        assertNotNull(analysis);
        assertTrue(analysis.hasGaps());
        assertEquals(3, analysis.followUpTasks().size());
    }

    @Test
    void testGapsFoundWithoutValidQuestionsIsComplete() {
        GapAnalysis analysis = service.parseGapAnalysis(
                "{\"status\": \"gaps_found\", \"followUpQuestions\": [{\"id\": \"f1\"}]}", 3, ModelCatalog.SONNET);
        assertNotNull(analysis);
        assertEquals(GapAnalysis.Status.COMPLETE, analysis.status());
    }

    @Test
    void testUnknownGapStatusIsNull() {
        assertNull(service.parseGapAnalysis("{\"status\": \"maybe\"}", 3, ModelCatalog.SONNET));
        assertNull(service.parseGapAnalysis("not json", 3, ModelCatalog.SONNET));
    }
}
