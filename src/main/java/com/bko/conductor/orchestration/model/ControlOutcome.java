package com.bko.conductor.orchestration.model;

/**
 * Result of an external control request against a run.
 */
public enum ControlOutcome {
    APPLIED,
    NOT_FOUND,
    /** The run exists but is not in a phase that accepts the request. */
    CONFLICT
}
