package com.meetprep.orchestrator.api.dto;

import com.meetprep.orchestrator.model.JobProgress;
import com.meetprep.orchestrator.model.JobRecord;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for GET /api/v1/jobs/{id}: the full job record including
 * every result written so far.
 */
public record JobResponse(
        String              jobId,
        String              type,
        String              status,
        Instant             createdAt,
        Instant             updatedAt,
        JobProgress         progress,
        Map<String, Object> results,
        String              error
) {
    public static JobResponse from(JobRecord job) {
        return new JobResponse(
                job.id(),
                job.workflowType().wireName(),
                job.status().wireName(),
                job.createdAt(),
                job.updatedAt(),
                job.progress(),
                job.results(),
                job.error()
        );
    }
}
