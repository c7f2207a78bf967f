package com.meetprep.orchestrator.api;

import com.meetprep.orchestrator.api.dto.QuickAgendaResponse;
import com.meetprep.orchestrator.api.dto.StepRunResponse;
import com.meetprep.orchestrator.service.StepInvocationService;
import com.meetprep.orchestrator.service.WorkflowValidationException;
import com.meetprep.orchestrator.step.StepExecutionException;
import com.meetprep.orchestrator.step.UnknownStepException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Synchronous single-step calls. No job is created; the response carries
 * the step's output directly.
 *
 * POST /api/v1/steps/{name}/run          — run one step on the given seed inputs
 * POST /api/v1/agenda/quick/{focusMode}  — agenda for a meeting context
 */
@RestController
@RequestMapping("/api/v1")
public class DirectStepController {

    private final StepInvocationService steps;

    public DirectStepController(StepInvocationService steps) {
        this.steps = steps;
    }

    /**
     * HTTP 200 — step output in {@code data}
     * HTTP 404 — no step with that name
     * HTTP 500 — the step failed
     */
    @PostMapping("/steps/{name}/run")
    public StepRunResponse runStep(@PathVariable String name,
                                   @RequestBody(required = false) Map<String, Object> inputs) {
        long start = System.nanoTime();
        Object data;
        try {
            data = steps.run(name, inputs);
        } catch (UnknownStepException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (StepExecutionException e) {
            throw failed(e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        return StepRunResponse.success(name.replace('-', '_'), data, elapsedMs);
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/v1/agenda/quick/blockers \
     *     -H "Content-Type: application/json" \
     *     -d '{"title":"Gateway rollout sync"}'
     */
    @PostMapping("/agenda/quick/{focusMode}")
    public QuickAgendaResponse quickAgenda(@PathVariable String focusMode,
                                           @RequestBody(required = false) Map<String, Object> meetingContext) {
        try {
            return new QuickAgendaResponse(focusMode, "success", steps.quickAgenda(focusMode, meetingContext));
        } catch (WorkflowValidationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (StepExecutionException e) {
            throw failed(e);
        }
    }

    private static ResponseStatusException failed(StepExecutionException e) {
        return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
    }
}
