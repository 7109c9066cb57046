package com.bko.conductor.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkerStatus {
    SUCCESS("success"),
    /** Timed out after streaming usable text. */
    PARTIAL("partial"),
    ERROR("error");

    private final String label;

    WorkerStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
