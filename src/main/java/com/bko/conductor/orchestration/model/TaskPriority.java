package com.bko.conductor.orchestration.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

public enum TaskPriority {
    CRITICAL("critical"),
    STANDARD("standard");

    private final String label;

    TaskPriority(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static TaskPriority fromLabel(@Nullable String value) {
        if (value != null && CRITICAL.label.equalsIgnoreCase(value.trim())) {
            return CRITICAL;
        }
        return STANDARD;
    }
}
