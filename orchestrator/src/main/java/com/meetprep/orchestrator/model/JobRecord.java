package com.meetprep.orchestrator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one job.
 *
 * Every transition returns a new instance; the Job Store swaps snapshots
 * atomically, so a reader always sees a consistent record. Transitions that
 * would break the lifecycle rules throw {@link IllegalStateException} and
 * leave the stored snapshot untouched.
 */
public final class JobRecord {

    /** Result key written only by the terminal synthesis step of a full workflow. */
    public static final String FINAL_OUTPUT = "final_output";

    private final String              id;
    private final JobStatus           status;
    private final Instant             createdAt;
    private final Instant             updatedAt;
    private final JobProgress         progress;
    private final Map<String, Object> results;
    private final String              error;

    private JobRecord(String id,
                      JobStatus status,
                      Instant createdAt,
                      Instant updatedAt,
                      JobProgress progress,
                      Map<String, Object> results,
                      String error) {
        this.id        = Objects.requireNonNull(id, "id");
        this.status    = Objects.requireNonNull(status, "status");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
        this.progress  = Objects.requireNonNull(progress, "progress");
        this.results   = results;
        this.error     = error;
    }

    public static JobRecord started(String id, JobProgress progress, Instant now) {
        return new JobRecord(id, JobStatus.STARTED, now, now, progress, Map.of(), null);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public JobRecord markRunning() {
        requireStatus(JobStatus.STARTED);
        return copy(JobStatus.RUNNING, progress, results, null);
    }

    public JobRecord beginStep(String stepName) {
        requireStatus(JobStatus.RUNNING);
        if (progress.completedSteps().contains(stepName)) {
            throw new IllegalStateException(
                    "Job " + id + " already completed step '" + stepName + "'");
        }
        return copy(status, progress.withCurrentStep(stepName), results, null);
    }

    /**
     * Record a finished step: append it to completed_steps and merge its outputs.
     * Result keys are owned by exactly one step and are never overwritten.
     */
    public JobRecord completeStep(String stepName, Map<String, Object> outputs) {
        requireStatus(JobStatus.RUNNING);
        if (progress.completedSteps().contains(stepName)) {
            throw new IllegalStateException(
                    "Job " + id + " already completed step '" + stepName + "'");
        }
        Map<String, Object> merged = new LinkedHashMap<>(results);
        outputs.forEach((key, value) -> {
            if (merged.containsKey(key)) {
                throw new IllegalStateException(
                        "Job " + id + " result '" + key + "' is already written");
            }
            merged.put(key, Objects.requireNonNull(value, key));
        });
        return copy(status, progress.withCompleted(stepName),
                Collections.unmodifiableMap(merged), null);
    }

    public JobRecord complete() {
        requireStatus(JobStatus.RUNNING);
        return copy(JobStatus.COMPLETED, progress.withCurrentStep(null), results, null);
    }

    /** Terminal failure. The step that was running stays visible in current_step. */
    public JobRecord fail(String reason) {
        requireStatus(JobStatus.RUNNING);
        String message = reason == null || reason.isBlank() ? "Job failed" : reason;
        return copy(JobStatus.FAILED, progress, results, message);
    }

    /** Only the Job Store stamps timestamps. */
    public JobRecord withUpdatedAt(Instant at) {
        return new JobRecord(id, status, createdAt, at, progress, results, error);
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public String              id()        { return id; }
    public JobStatus           status()    { return status; }
    public Instant             createdAt() { return createdAt; }
    public Instant             updatedAt() { return updatedAt; }
    public JobProgress         progress()  { return progress; }
    public Map<String, Object> results()   { return results; }
    public String              error()     { return error; }

    public boolean      isTerminal()   { return status.isTerminal(); }
    public WorkflowType workflowType() { return progress.workflowType(); }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Job " + id + " is " + status.wireName() + ", expected " + expected.wireName());
        }
    }

    private JobRecord copy(JobStatus newStatus, JobProgress newProgress,
                           Map<String, Object> newResults, String newError) {
        return new JobRecord(id, newStatus, createdAt, updatedAt, newProgress, newResults, newError);
    }

    @Override
    public String toString() {
        return "JobRecord{id=" + id + ", status=" + status + ", progress=" + progress + "}";
    }
}
