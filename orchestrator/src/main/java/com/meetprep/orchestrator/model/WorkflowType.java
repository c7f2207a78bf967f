package com.meetprep.orchestrator.model;

/**
 * The three step-sequencing shapes a job can be started with.
 */
public enum WorkflowType {
    FULL,       // fixed research pipeline ending in final synthesis
    CUSTOM,     // caller-selected ordered subset of steps
    AGENDA;     // agenda → pre-read collection → participant briefings

    public String wireName() {
        return name().toLowerCase();
    }
}
