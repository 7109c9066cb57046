package com.bko.conductor.api;

import com.bko.conductor.orchestration.model.ConversationMessage;
import com.bko.conductor.orchestration.model.OrchestrationMode;
import com.bko.conductor.orchestration.model.ResearchDepth;
import com.bko.conductor.orchestration.model.RunOptions;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record ChatRequest(
        @NotBlank String message,
        OrchestrationMode mode,
        ResearchDepth depth,
        String model,
        List<ConversationMessage> history
) {
    public RunOptions toRunOptions() {
        return new RunOptions(mode, depth, model, false, history);
    }
}
