package com.bko.conductor.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OrchestrationPhase {
    PLANNING("planning"),
    REVIEWING("reviewing"),
    EXECUTING("executing"),
    GAP_CHECK("gap-check"),
    FOLLOW_UP("follow-up"),
    SYNTHESIZING("synthesizing"),
    REVISION("revision"),
    DONE("done"),
    ERROR("error");

    private final String label;

    OrchestrationPhase(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
