package com.meetprep.orchestrator.api;

import com.meetprep.orchestrator.api.dto.CancelResponse;
import com.meetprep.orchestrator.api.dto.JobResponse;
import com.meetprep.orchestrator.api.dto.JobSummaryResponse;
import com.meetprep.orchestrator.service.JobQueryService;
import com.meetprep.orchestrator.service.WorkflowOrchestrator;
import com.meetprep.orchestrator.store.JobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for job status.
 *
 * GET    /api/v1/jobs              — summaries of every retained job
 * GET    /api/v1/jobs/{id}         — full record of one job, results included
 * DELETE /api/v1/jobs/{id}         — forget a job
 * POST   /api/v1/jobs/{id}/cancel  — stop a job that has not finished
 */
@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

    private final JobQueryService      queries;
    private final WorkflowOrchestrator orchestrator;

    public JobController(JobQueryService queries, WorkflowOrchestrator orchestrator) {
        this.queries      = queries;
        this.orchestrator = orchestrator;
    }

    @GetMapping
    public List<JobSummaryResponse> listJobs() {
        return queries.listJobs().stream()
                .map(JobSummaryResponse::from)
                .toList();
    }

    /**
     * Poll the current state of a job.
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable String id) {
        try {
            return JobResponse.from(queries.getJob(id));
        } catch (JobNotFoundException e) {
            throw notFound(e);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteJob(@PathVariable String id) {
        try {
            queries.deleteJob(id);
        } catch (JobNotFoundException e) {
            throw notFound(e);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * HTTP 202 — cancellation requested, or the job had already finished
     *            (cancelled=false)
     * HTTP 404 — job ID not found
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<CancelResponse> cancel(@PathVariable String id) {
        try {
            boolean cancelled = orchestrator.cancel(id);
            return ResponseEntity.accepted().body(new CancelResponse(id, cancelled));
        } catch (JobNotFoundException e) {
            throw notFound(e);
        }
    }

    private static ResponseStatusException notFound(JobNotFoundException e) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
    }
}
