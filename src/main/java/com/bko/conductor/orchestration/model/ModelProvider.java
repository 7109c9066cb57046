package com.bko.conductor.orchestration.model;

public enum ModelProvider {
    /** Claude-family models, reached through the OpenAI-compatible gateway. */
    ANTHROPIC,
    /** Gemini-family models, reached through Google GenAI. */
    GOOGLE
}
