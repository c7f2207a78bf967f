package com.meetprep.orchestrator.api;

import com.meetprep.orchestrator.api.dto.AgendaWorkflowRequest;
import com.meetprep.orchestrator.api.dto.CustomWorkflowRequest;
import com.meetprep.orchestrator.api.dto.FullWorkflowRequest;
import com.meetprep.orchestrator.api.dto.JobAcceptedResponse;
import com.meetprep.orchestrator.service.FullWorkflowOptions;
import com.meetprep.orchestrator.service.JobQueryService;
import com.meetprep.orchestrator.service.WorkflowOrchestrator;
import com.meetprep.orchestrator.service.WorkflowValidationException;
import com.meetprep.orchestrator.store.JobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.function.Supplier;

/**
 * REST API for starting preparation workflows.
 *
 * POST /api/v1/meetings/prepare         — full research pipeline
 * POST /api/v1/meetings/prepare-custom  — caller-selected subset of steps
 * POST /api/v1/agenda/comprehensive     — agenda, pre-reads and participant briefings
 *
 * Every endpoint answers 201 as soon as the job exists; the work itself
 * runs in the background.
 */
@RestController
@RequestMapping("/api/v1")
public class WorkflowController {

    private final WorkflowOrchestrator orchestrator;
    private final JobQueryService      queries;

    public WorkflowController(WorkflowOrchestrator orchestrator, JobQueryService queries) {
        this.orchestrator = orchestrator;
        this.queries      = queries;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/v1/meetings/prepare \
     *     -H "Content-Type: application/json" \
     *     -d '{"meeting_context":"Quarterly platform review","include_agenda":true}'
     */
    @PostMapping("/meetings/prepare")
    public ResponseEntity<JobAcceptedResponse> prepare(@RequestBody(required = false) FullWorkflowRequest req) {
        FullWorkflowOptions options = req == null ? FullWorkflowOptions.defaults() : req.toOptions();
        return accepted(() -> orchestrator.startFull(options), "Meeting preparation started");
    }

    @PostMapping("/meetings/prepare-custom")
    public ResponseEntity<JobAcceptedResponse> prepareCustom(@RequestBody CustomWorkflowRequest req) {
        return accepted(() -> orchestrator.startCustom(req.steps(), req.seeds()),
                "Custom meeting preparation started");
    }

    @PostMapping("/agenda/comprehensive")
    public ResponseEntity<JobAcceptedResponse> comprehensiveAgenda(@RequestBody AgendaWorkflowRequest req) {
        return accepted(() -> orchestrator.startAgenda(req.meetingContext(), req.focusMode(), req.participantRoles()),
                "Comprehensive agenda preparation started");
    }

    private ResponseEntity<JobAcceptedResponse> accepted(Supplier<String> start, String message) {
        String jobId;
        try {
            jobId = start.get();
        } catch (WorkflowValidationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        JobAcceptedResponse body;
        try {
            body = JobAcceptedResponse.from(queries.getJob(jobId), message);
        } catch (JobNotFoundException e) {
            // deleted between acceptance and this read
            body = new JobAcceptedResponse(jobId, "started", message, null);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }
}
