package com.meetprep.orchestrator.service;

import com.meetprep.orchestrator.model.JobProgress;
import com.meetprep.orchestrator.model.WorkflowType;
import com.meetprep.orchestrator.pipeline.PipelineExecutor;
import com.meetprep.orchestrator.pipeline.PipelineStep;
import com.meetprep.orchestrator.step.StepManifest;
import com.meetprep.orchestrator.step.StepRegistry;
import com.meetprep.orchestrator.store.JobNotFoundException;
import com.meetprep.orchestrator.store.JobStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.meetprep.orchestrator.step.StepCatalog.*;

/**
 * Accepts workflow requests and turns each into a tracked, detached job.
 *
 * Every start method validates the request, creates the job record
 * (status=started), dispatches one pipeline task on the job worker pool and
 * returns the job id without waiting. Progress is then observed through
 * {@link JobQueryService}.
 *
 * Workflow shapes:
 * <pre>
 *   full   : calendar → people_research → technical_context
 *            → [slack_context] → [agenda_builder] → coordinator
 *   custom : caller-selected ordered subset, all required
 *   agenda : agenda_builder → preread_collector → [context_briefing]
 * </pre>
 * Bracketed steps are optional and gated by a request flag.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final JobStore         store;
    private final StepRegistry     registry;
    private final PipelineExecutor pipeline;
    private final ExecutorService  jobWorkers;

    // Jobs whose task has not finished yet, for cancellation.
    private final Map<String, JobHandle> inFlight = new ConcurrentHashMap<>();

    /**
     * A dispatched task. Whoever claims it first owns the job's outcome: the
     * worker thread by running the pipeline, or a cancel that withdraws it.
     */
    private record JobHandle(WorkflowType workflow, FutureTask<Void> task, AtomicBoolean claimed) {
        boolean claim() {
            return claimed.compareAndSet(false, true);
        }
    }

    public WorkflowOrchestrator(JobStore store,
                                StepRegistry registry,
                                PipelineExecutor pipeline,
                                @Qualifier("jobWorkers") ExecutorService jobWorkers) {
        this.store      = store;
        this.registry   = registry;
        this.pipeline   = pipeline;
        this.jobWorkers = jobWorkers;
    }

    // ------------------------------------------------------------------
    // Workflow acceptance
    // ------------------------------------------------------------------

    public String startFull(FullWorkflowOptions options) {
        FullWorkflowOptions opts = options == null ? FullWorkflowOptions.defaults() : options;
        validateFocusMode(opts.focusMode());

        List<PipelineStep> steps = fullPipeline(opts);

        Map<String, Object> seeds = new LinkedHashMap<>();
        putIfPresent(seeds, MEETING_CONTEXT, opts.meetingContext());
        seeds.put(USER_PREFERENCES, opts.userPreferences());
        seeds.put(FOCUS_MODE, opts.focusMode());

        String jobId = store.create(JobProgress.initial(PipelineStep.countEnabled(steps), null, null));
        log.info("Accepted full workflow job {} (includeSlack={}, includeAgenda={})",
                jobId, opts.includeSlack(), opts.includeAgenda());
        dispatch(jobId, WorkflowType.FULL, steps, seeds);
        return jobId;
    }

    /**
     * Run an explicit ordered subset of registered steps.
     *
     * @param stepNames step names, each registered and listed once
     * @param seedData  pre-existing data keyed like step results, e.g.
     *                  {@code {"calendar": "..."}}; may be null
     * @throws WorkflowValidationException before any job exists when a name is
     *         unknown, duplicated, or two steps would write the same result key
     */
    public String startCustom(List<String> stepNames, Map<String, Object> seedData) {
        if (stepNames == null || stepNames.isEmpty()) {
            throw new WorkflowValidationException("At least one step is required");
        }

        List<String> unknown = stepNames.stream().filter(n -> !registry.contains(n)).toList();
        if (!unknown.isEmpty()) {
            throw new WorkflowValidationException(
                    "Unknown step(s): " + unknown + ". Available: " + registry.stepNames());
        }

        Set<String> seen = new HashSet<>();
        Map<String, String> writers = new HashMap<>();
        List<PipelineStep> steps = new ArrayList<>();
        for (String name : stepNames) {
            if (!seen.add(name)) {
                throw new WorkflowValidationException("Duplicate step: '" + name + "'");
            }
            StepManifest manifest = registry.manifest(name);
            for (String key : manifest.outputKeys()) {
                String other = writers.putIfAbsent(key, name);
                if (other != null) {
                    throw new WorkflowValidationException(
                            "Steps '" + other + "' and '" + name + "' both write result '" + key + "'");
                }
            }
            steps.add(PipelineStep.required(manifest));
        }

        Map<String, Object> seeds = new LinkedHashMap<>();
        if (seedData != null) {
            seedData.forEach((k, v) -> putIfPresent(seeds, k, v));
        }

        String jobId = store.create(JobProgress.initial(steps.size(), stepNames, null));
        log.info("Accepted custom workflow job {} with steps {}", jobId, stepNames);
        dispatch(jobId, WorkflowType.CUSTOM, steps, seeds);
        return jobId;
    }

    /**
     * Multi-stage agenda preparation. The terminal output is
     * {@code results.agenda}; participant briefings run only when roles are given.
     */
    public String startAgenda(Map<String, Object> meetingContext,
                              String focusMode,
                              Map<String, String> participantRoles) {
        if (meetingContext == null) {
            throw new WorkflowValidationException("meeting_context is required");
        }
        String focus = focusMode == null || focusMode.isBlank() ? DEFAULT_FOCUS_MODE : focusMode;
        validateFocusMode(focus);

        boolean withBriefings = participantRoles != null && !participantRoles.isEmpty();
        List<PipelineStep> steps = List.of(
                PipelineStep.required(resolve(AGENDA_BUILDER)),
                PipelineStep.required(resolve(PREREAD_COLLECTOR)),
                PipelineStep.optional(resolve(CONTEXT_BRIEFING), withBriefings));

        Map<String, Object> seeds = new LinkedHashMap<>();
        seeds.put(MEETING_CONTEXT, meetingContext);
        seeds.put(FOCUS_MODE, focus);
        if (withBriefings) {
            seeds.put(PARTICIPANT_ROLES, participantRoles);
        }

        String jobId = store.create(JobProgress.initial(PipelineStep.countEnabled(steps), null, focus));
        log.info("Accepted agenda workflow job {} (focus={}, briefings={})", jobId, focus, withBriefings);
        dispatch(jobId, WorkflowType.AGENDA, steps, seeds);
        return jobId;
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Cancel a job that has not finished.
     *
     * The decision is taken inside a store update, serialized with the
     * pipeline's own transitions: either the job is already terminal and
     * nothing changes, or it is guaranteed to end failed with error
     * {@value PipelineExecutor#CANCELLED_MESSAGE}. A running pipeline is
     * flagged and fails the job at its next transition; a queued task is
     * withdrawn and the job failed here, after being marked running.
     *
     * @return false if the job already reached a terminal state
     * @throws JobNotFoundException if no such job exists
     */
    public boolean cancel(String jobId) {
        AtomicBoolean accepted = new AtomicBoolean();
        boolean exists = store.update(jobId, r -> {
            if (!r.isTerminal()) {
                accepted.set(true);
                pipeline.requestCancel(jobId);
            }
            return r;
        });
        if (!exists) {
            throw new JobNotFoundException(jobId);
        }
        if (!accepted.get()) {
            return false;
        }

        JobHandle handle = inFlight.remove(jobId);
        if (handle != null && handle.claim()) {
            handle.task().cancel(false);
            pipeline.failUnstarted(jobId, handle.workflow(), PipelineExecutor.CANCELLED_MESSAGE);
            log.info("Job {} cancelled before its pipeline started", jobId);
        } else {
            if (handle != null) {
                handle.task().cancel(true);
            }
            log.info("Cancellation requested for running job {}", jobId);
        }
        return true;
    }

    @PreDestroy
    public void shutdown() {
        if (!inFlight.isEmpty()) {
            log.warn("Shutting down with {} job(s) in flight; cancelling them", inFlight.size());
        }
        List.copyOf(inFlight.keySet()).forEach(id -> {
            try {
                cancel(id);
            } catch (JobNotFoundException e) {
                inFlight.remove(id);
            }
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    List<PipelineStep> fullPipeline(FullWorkflowOptions opts) {
        return List.of(
                PipelineStep.required(resolve(CALENDAR)),
                PipelineStep.required(resolve(PEOPLE_RESEARCH)),
                PipelineStep.required(resolve(TECHNICAL_CONTEXT)),
                PipelineStep.optional(resolve(SLACK_CONTEXT), opts.includeSlack()),
                PipelineStep.optional(resolve(AGENDA_BUILDER), opts.includeAgenda()),
                PipelineStep.required(resolve(COORDINATOR)));
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private void dispatch(String jobId, WorkflowType workflow, List<PipelineStep> steps,
                          Map<String, Object> seeds) {
        AtomicBoolean claimed = new AtomicBoolean();
        FutureTask<Void> task = new FutureTask<>(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                pipeline.run(jobId, workflow, steps, seeds);
            } finally {
                inFlight.remove(jobId);
            }
        }, null);
        JobHandle handle = new JobHandle(workflow, task, claimed);
        inFlight.put(jobId, handle);
        try {
            jobWorkers.execute(task);
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobId);
            log.error("Job {} could not be dispatched: {}", jobId, e.getMessage());
            if (handle.claim()) {
                pipeline.failUnstarted(jobId, workflow,
                        "Job could not be scheduled: orchestrator is shutting down");
            }
        }
    }

    private StepManifest resolve(String name) {
        if (!registry.contains(name)) {
            throw new WorkflowValidationException("Step '" + name + "' is not available");
        }
        return registry.manifest(name);
    }

    private static void validateFocusMode(String focusMode) {
        if (!FOCUS_MODES.contains(focusMode)) {
            throw new WorkflowValidationException(
                    "Invalid focus mode '" + focusMode + "'. Expected one of " + FOCUS_MODES);
        }
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (key != null && value != null) {
            target.put(key, value);
        }
    }
}
