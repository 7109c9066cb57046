package com.bko.conductor.orchestration.model;

public enum OrchestrationMode {
    /** General task decomposition across worker models. */
    COMMANDER,
    /** Sub-question research with optional gap analysis. */
    RESEARCH
}
