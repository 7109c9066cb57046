package com.bko.conductor.orchestration.model;

public enum ResearchDepth {
    QUICK,
    DEEP
}
