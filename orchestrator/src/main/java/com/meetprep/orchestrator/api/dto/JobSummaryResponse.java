package com.meetprep.orchestrator.api.dto;

import com.meetprep.orchestrator.model.JobProgress;
import com.meetprep.orchestrator.model.JobSummary;

import java.time.Instant;
import java.util.List;

/**
 * One entry of GET /api/v1/jobs. Result bodies are left out; resultKeys
 * names what a full read would return.
 */
public record JobSummaryResponse(
        String       jobId,
        String       type,
        String       status,
        Instant      createdAt,
        Instant      updatedAt,
        JobProgress  progress,
        List<String> resultKeys,
        String       error
) {
    public static JobSummaryResponse from(JobSummary s) {
        return new JobSummaryResponse(
                s.id(),
                s.type().wireName(),
                s.status().wireName(),
                s.createdAt(),
                s.updatedAt(),
                s.progress(),
                s.resultKeys(),
                s.error()
        );
    }
}
