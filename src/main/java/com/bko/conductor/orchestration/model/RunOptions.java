package com.bko.conductor.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Per-run switches.
 *
 * @param preferredModel fallback worker model for tasks the planner left unassigned
 * @param autoApprove    skip the review gate, used by blocking callers that cannot answer it
 */
public record RunOptions(
        OrchestrationMode mode,
        ResearchDepth depth,
        @Nullable String preferredModel,
        boolean autoApprove,
        List<ConversationMessage> history
) {
    public RunOptions {
        mode = mode == null ? OrchestrationMode.COMMANDER : mode;
        depth = depth == null ? ResearchDepth.DEEP : depth;
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static RunOptions commander() {
        return new RunOptions(OrchestrationMode.COMMANDER, ResearchDepth.DEEP, null, false, List.of());
    }

    public static RunOptions research(ResearchDepth depth) {
        return new RunOptions(OrchestrationMode.RESEARCH, depth, null, false, List.of());
    }

    public RunOptions withAutoApprove() {
        return new RunOptions(mode, depth, preferredModel, true, history);
    }

    public boolean research() {
        return mode == OrchestrationMode.RESEARCH;
    }

    public boolean quickResearch() {
        return research() && depth == ResearchDepth.QUICK;
    }

    public boolean deepResearch() {
        return research() && depth == ResearchDepth.DEEP;
    }
}
