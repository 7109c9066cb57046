package com.bko.conductor.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // LLM Request Purposes
    public static final String PURPOSE_PLAN = "plan";
    public static final String PURPOSE_PLAN_RETRY = "plan-retry";
    public static final String PURPOSE_RESEARCH_PLAN = "research-plan";
    public static final String PURPOSE_RESEARCH_PLAN_RETRY = "research-plan-retry";
    public static final String PURPOSE_WORKER_TASK = "worker-task";
    public static final String PURPOSE_WORKER_RETRY = "worker-retry";
    public static final String PURPOSE_RESEARCH_WORKER = "research-worker";
    public static final String PURPOSE_GAP_CHECK = "gap-check";
    public static final String PURPOSE_SYNTHESIS = "synthesis";
    public static final String PURPOSE_REVISION = "revision";
    public static final String PURPOSE_QUALITY_CHECK = "quality-check";

    // Context limits
    public static final int MAX_CONTEXT_MESSAGES = 6;
    public static final int MAX_RESEARCH_CONTEXT_MESSAGES = 10;
    public static final int MAX_CONTEXT_MESSAGE_CHARS = 800;
    public static final int MAX_DESCRIPTION_CHARS = 80;
    public static final int RAW_OUTPUT_EXCERPT_CHARS = 300;
    public static final int QUALITY_QUESTION_CHARS = 500;
    public static final int QUALITY_RESPONSE_CHARS = 4000;
    public static final int REVISION_PREVIOUS_CHARS = 3000;

    public static final double QUALITY_CHECK_COST = 0.001;

    // Default messages
    public static final String RESULT_DIVIDER = "\n\n---\n\n";
    public static final String TRUNCATED_SUFFIX = "... [truncated]";
    public static final String DEFAULT_SYNTHESIS_HINT = "Merge all results into a coherent response.";
    public static final String WORKER_FAILED_MESSAGE = "Worker failed: ";
    public static final String ALL_FAILED_MESSAGE = "All workers and synthesis failed. Please try again.";
    public static final String PARTIAL_TAG = " (partial, worker timed out)";

    public static final String COMMANDER_PLANNING_PROMPT = """
            You are the planner of a team of AI workers drawn from several model providers. Read the request, \
            work out what it really needs, and split it into the smallest set of focused tasks that together \
            answer it well.

            Available worker models (strongest first):
            - claude-opus-4-6: strongest Claude model. Hard coding problems, architecture, critical work.
            - claude-sonnet-4-6: balanced speed and quality. Default choice for coding and analysis.
            - claude-haiku-4-5-20251001: fastest Claude model. Lookups, formatting, classification.
            - gemini-3-pro-preview: strongest Gemini model with built-in extended thinking.
            - gemini-3-flash-preview: fast thinking model for reasoning at speed.
            - gemini-2.5-pro: long-context analysis, research, technical documentation.
            - gemini-2.5-flash: fastest Gemini model. Summaries, translation, simple tasks.

            Model selection:
            - Creation (code, features, architecture): claude-opus-4-6, claude-sonnet-4-6 or gemini-3-pro-preview.
            - Analysis and review: claude-sonnet-4-6 or gemini-3-pro-preview.
            - Research and documentation lookup: gemini-2.5-pro or gemini-3-flash-preview.
            - Auxiliary work (formatting, classification, short summaries): claude-haiku-4-5-20251001 or gemini-2.5-flash.

            Rules:
            1. Output ONLY valid JSON matching the schema below. No markdown fences and no text outside the JSON.
            2. Create 1-7 tasks. Simple questions get a single task on the best model.
            3. Every task prompt must be self-contained. Workers see nothing from other tasks unless the task \
            lists them in "dependsOn", in which case it receives their output as context.
            4. Use "dependsOn" only when a task genuinely needs another task's result. Independent tasks run in parallel.
            5. Mark a task "critical" when the final answer cannot be produced without it.
            6. Keep "reasoning" to 1-2 sentences and each task prompt to 2-5 sentences. The whole JSON must stay \
            under 4000 characters.
            7. Scope each task so one worker can finish it in a single response.
            8. Include a synthesisHint describing how to merge the results.

            Schema:
            {
              "reasoning": "1-2 sentence explanation",
              "tasks": [
                {
                  "id": "task-1",
                  "description": "What this task does",
                  "model": "claude-sonnet-4-6",
                  "prompt": "The exact prompt to send to this worker",
                  "priority": "critical",
                  "dependsOn": []
                }
              ],
              "synthesisHint": "Instructions for merging results"
            }""";

    public static final String COMMANDER_BUILD_PLANNING_PROMPT = """
            You are the planner for a build request. Split the build into exactly 2 parallel workers, one Claude \
            and one Gemini, each owning a separate set of files. No file may be assigned to both workers.

            Available workers:
            - claude-sonnet-4-6: coding, UI components, complex logic, architecture.
            - gemini-3-pro-preview: coding, algorithms, data processing, system design.

            Rules:
            1. Output ONLY valid JSON matching the schema below. No markdown fences.
            2. Create EXACTLY 2 tasks, one on claude-sonnet-4-6 and one on gemini-3-pro-preview.
            3. If the build is trivial (1-2 files in total), create a single task on the best model instead.
            4. Each task prompt must list the exact files to create or modify. Zero file overlap between tasks.
            5. Each task prompt must be self-contained.
            6. Mark both tasks "critical".
            7. Keep task prompts to 3-6 sentences.
            8. Include a synthesisHint describing how to report the combined build result.

            Schema:
            {
              "reasoning": "1-2 sentence build strategy explaining the split",
              "tasks": [
                {
                  "id": "task-1",
                  "description": "What this worker builds",
                  "model": "claude-sonnet-4-6",
                  "prompt": "Build instructions listing the exact files to create or modify",
                  "priority": "critical"
                },
                {
                  "id": "task-2",
                  "description": "What this worker builds",
                  "model": "gemini-3-pro-preview",
                  "prompt": "Build instructions listing the exact files to create or modify",
                  "priority": "critical"
                }
              ],
              "synthesisHint": "Report what was built, listing created files and key changes"
            }""";

    public static final String COMMANDER_SYNTHESIS_PROMPT = """
            Several workers have answered parts of the user's request in parallel. Merge their output into one \
            answer that reads as if a single expert wrote it.

            Rules:
            1. Produce a unified, natural response.
            2. Do NOT mention workers, tasks or that several models were involved.
            3. When results contradict each other, prefer the more detailed and accurate one.
            4. If a worker failed, work around it with the results that are available.
            5. If every worker failed, say plainly that the request could not be completed.""";

    public static final String RESEARCH_PLANNING_PROMPT = """
            You are a research planner. Break the user's query into focused sub-questions that together give a \
            comprehensive answer.

            Available worker models (all have web search access):
            - gemini-2.5-flash: fast fact-finding and data lookup.
            - gemini-2.5-pro: complex topics and long documents. Lower rate limits, assign sparingly.
            - gemini-3-flash-preview: fast thinking model for reasoning at speed.
            - gemini-3-pro-preview: deepest Gemini reasoning. Lowest rate limits, at most 2 questions.
            - gemini-3.1-pro-preview: latest Gemini preview. Use for critical questions only.
            - claude-sonnet-4-6: strong all-rounder for analysis and nuanced writing.
            - claude-haiku-4-5-20251001: fastest model for simple fact lookup.

            Output ONLY valid JSON matching this schema. No markdown fences and no text outside the JSON.

            {
              "reasoning": "Why these sub-questions cover the topic",
              "questions": [
                {
                  "id": "q1",
                  "question": "The specific sub-question to research",
                  "searchQuery": "Concise web search query",
                  "model": "gemini-2.5-pro",
                  "priority": "critical",
                  "dependsOn": []
                }
              ]
            }

            Rules:
            1. %s Each question must be self-contained and specific.
            2. Assign the best model for each question's complexity.
            3. Search queries are short keyword queries, not sentences.
            4. Mark a question "critical" when the report cannot be complete without it.
            5. Cover different angles: facts, comparisons, expert opinion, recent developments, practical impact.
            6. Avoid overlapping questions.
            7. Spread load across models. Pro models allow only a few requests per minute, so give most questions \
            to flash models.
            8. Use "dependsOn" only when a question needs another question's findings. Dependent questions \
            receive those findings as context.""";

    public static final String RESEARCH_QUICK_COUNT_GUIDANCE = "Create exactly 2-3 sub-questions.";

    public static final String RESEARCH_DEEP_COUNT_GUIDANCE = "Create as many sub-questions as the topic needs: "
            + "4-5 for simple topics, 8-12 for complex ones. Prefer focused questions over broad ones. Maximum %d.";

    public static final String RESEARCH_WORKER_PROMPT = """
            You are a research worker. Research one specific question thoroughly using web search and page reading.

            Strategy:
            1. Run 2-3 searches from different angles.
            2. Read the 2-3 most relevant and authoritative pages in full.
            3. Extract key findings, data points, statistics and expert quotes with attribution.
            4. If results are thin, try alternative queries or follow links from good sources.

            Output rules:
            - Dense findings of roughly 500-800 words, using bullet points and short paragraphs.
            - Inline [Source: full-url] citations with full URLs, not bare domain names.
            - Prefer recent, authoritative sources and include concrete numbers and dates.
            - Note conflicting information together with both sources.""";

    public static final String RESEARCH_GAP_PROMPT = """
            You are a research quality analyst. Review the combined findings and decide whether critical gaps remain.

            Output ONLY valid JSON:

            {
              "status": "complete" | "gaps_found",
              "reasoning": "Brief assessment",
              "followUpQuestions": [
                {
                  "id": "f1",
                  "question": "Specific gap that needs more research",
                  "searchQuery": "Search query to fill this gap",
                  "model": "gemini-2.5-pro",
                  "priority": "critical"
                }
              ]
            }

            Rules:
            1. Answer "complete" when the findings cover the topic adequately.
            2. Only create follow-ups for genuine gaps: missing perspectives, unresolved contradictions or \
            uncovered aspects.
            3. At most 2-3 follow-up questions.
            4. Do not repeat topics that are already well covered.""";

    public static final String RESEARCH_SYNTHESIS_PROMPT = """
            You are a research synthesis expert. Compile the findings into a clean, well-formatted report.

            Structure:
            ## Executive Summary
            (3-5 sentences with the most important takeaways)

            ## <Thematic section>
            (Organized by theme, not by source. Short paragraphs separated by blank lines.)

            ## Key Findings
            (5-10 actionable bullet points)

            ## Sources
            1. [Domain](https://full-url) - short description

            Rules:
            1. Merge overlapping findings into themes instead of concatenating them.
            2. Cite sources inline as [1], [2] matching the Sources list.
            3. Note both sides of any contradiction and flag weak evidence.
            4. Keep paragraphs to 2-3 sentences and use bold for key terms and figures.
            5. Do NOT mention workers, sub-questions or the research pipeline.""";

    public static final String QUALITY_CHECK_PROMPT = """
            You are a quality reviewer. Score the response to the user's question on three dimensions:

            1. COMPLETENESS: does it address every part of the question?
            2. DEPTH: is it substantive rather than vague?
            3. ORGANIZATION: is it clear and easy to follow?

            Output ONLY valid JSON:
            {"score": 7, "issues": null}

            - score: integer 1-10, the average of the three dimensions
            - issues: null when score >= 7, otherwise 1-2 sentences naming what is missing or weak

            Most good responses score 7-8. Reserve 9-10 for exceptional answers.""";

    // Message templates
    public static final String DEPENDENCY_CONTEXT_HEADER =
            "The following tasks have already been completed. Use their outputs as context:\n\n";
    public static final String DEPENDENCY_CONTEXT_FOOTER = "\n\n---\n\nNow complete your task:\n";
    public static final String RESEARCH_DEPENDENCY_HEADER =
            "The following research has already been completed. Build on it and do not repeat it:\n\n";

    public static final String RESEARCH_WORKER_TEMPLATE = """
            Research the following question thoroughly:

            **Question:** %s

            **Suggested search query:** %s

            Search the web for authoritative sources and read them in full. \
            Return detailed findings with [Source: full-url] citations.""";

    public static final String COMMANDER_SYNTHESIS_TEMPLATE = """
            Original user message: %s

            Plan reasoning: %s
            Synthesis instructions: %s

            Worker results:
            %s

            Synthesize these into a single coherent response.""";

    public static final String RESEARCH_SYNTHESIS_TEMPLATE = """
            Original research query: %s

            Research scope: %s

            All research findings:
            %s

            Synthesize these into a single, comprehensive research report. \
            Follow the format specified in your instructions.""";

    public static final String GAP_ANALYSIS_TEMPLATE = """
            Original research query: %s

            Research plan: %s

            Sub-questions researched:
            %s

            Findings:
            %s

            Evaluate whether these findings comprehensively answer the original query, \
            or if critical gaps remain.""";

    public static final String REVISION_TEMPLATE = """
            %s

            ---

            REVISION REQUEST: A quality review found these issues with the previous attempt:
            %s

            Previous synthesis for reference:
            %s

            Please produce a revised synthesis that specifically addresses the quality feedback. \
            Maintain all correct content from the previous attempt while fixing the identified issues.""";

    // Error messages
    public static final String PLANNING_NO_OUTPUT_ERROR =
            "Planning phase failed: %s returned no output after 2 attempts (%ds timeout per attempt)";
    public static final String PLANNING_INVOCATION_ERROR = "Planning failed (%s): %s";
    public static final String PLANNING_PARSE_ERROR =
            "Planning failed: could not parse task plan from %s response.\n\nRaw output start: %s";
    public static final String CRITICAL_FAILURE_ERROR = "All %d critical workers failed:\n%s";
    public static final String UNEXPECTED_PHASE_ERROR = "Phase %s failed unexpectedly: %s";
    public static final String CANCELLED_ERROR = "Run cancelled during %s";
    public static final String REJECTED_ERROR = "Plan rejected";
}
