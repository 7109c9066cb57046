package com.bko.conductor.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InvocationOutcome {
    SUCCESS("success"),
    PARTIAL("partial"),
    ERROR("error");

    private final String label;

    InvocationOutcome(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
