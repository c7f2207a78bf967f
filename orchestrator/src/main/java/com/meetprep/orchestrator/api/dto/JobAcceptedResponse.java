package com.meetprep.orchestrator.api.dto;

import com.meetprep.orchestrator.model.JobRecord;
import com.meetprep.orchestrator.model.JobStatus;

import java.time.Instant;

/**
 * Response body of the three workflow endpoints. The job runs detached;
 * poll GET /api/v1/jobs/{jobId} for its progress. Status is always
 * "started": it describes the job as accepted, not as it is by now.
 */
public record JobAcceptedResponse(String jobId, String status, String message, Instant createdAt) {

    public static JobAcceptedResponse from(JobRecord job, String message) {
        return new JobAcceptedResponse(job.id(), JobStatus.STARTED.wireName(), message, job.createdAt());
    }
}
