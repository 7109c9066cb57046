package com.bko.conductor.stream;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StreamEventType {
    SNAPSHOT("snapshot"),
    STATUS("status"),
    PLAN("plan"),
    FINAL("final"),
    ERROR("error"),
    RUN_CANCEL("run-cancel"),
    RUN_COMPLETE("run-complete");

    private final String label;

    StreamEventType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Closes the stream; the run becomes eligible for cleanup once its sessions disconnect. */
    boolean closesRun() {
        return this == RUN_COMPLETE;
    }

    /** Non-snapshot events still delivered after a cancel, so clients see how the run ended. */
    boolean deliveredAfterCancel() {
        return this == RUN_CANCEL || this == ERROR || this == RUN_COMPLETE;
    }
}
