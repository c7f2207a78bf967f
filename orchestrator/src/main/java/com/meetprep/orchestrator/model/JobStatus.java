package com.meetprep.orchestrator.model;

/**
 * Lifecycle of a preparation job.
 *
 * Transitions:
 *   STARTED → RUNNING → COMPLETED
 *   RUNNING → FAILED  (a required step raised or timed out, or the job was cancelled)
 *
 * A job cancelled or rejected before its pipeline ran is still marked
 * RUNNING, in its own store update, before it is failed.
 *
 * COMPLETED and FAILED are terminal.
 */
public enum JobStatus {
    STARTED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Lower-case name used on the wire ("started", "running", ...). */
    public String wireName() {
        return name().toLowerCase();
    }
}
