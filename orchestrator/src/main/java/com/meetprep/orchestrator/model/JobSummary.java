package com.meetprep.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Lightweight view of a job for list queries: no result payloads, only the
 * names of the result keys written so far.
 */
public record JobSummary(
        String       id,
        WorkflowType type,
        JobStatus    status,
        Instant      createdAt,
        Instant      updatedAt,
        JobProgress  progress,
        List<String> resultKeys,
        String       error
) {
    public static JobSummary from(JobRecord r) {
        return new JobSummary(
                r.id(),
                r.workflowType(),
                r.status(),
                r.createdAt(),
                r.updatedAt(),
                r.progress(),
                List.copyOf(r.results().keySet()),
                r.error()
        );
    }
}
