package com.meetprep.orchestrator.pipeline;

import com.meetprep.orchestrator.model.JobRecord;
import com.meetprep.orchestrator.model.JobStatus;
import com.meetprep.orchestrator.model.WorkflowType;
import com.meetprep.orchestrator.step.StepExecutionContext;
import com.meetprep.orchestrator.step.StepExecutionException;
import com.meetprep.orchestrator.step.StepInputs;
import com.meetprep.orchestrator.step.StepRegistry;
import com.meetprep.orchestrator.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Runs one job's steps strictly in order and records every transition in
 * the {@link JobStore}.
 *
 * For each enabled step:
 *   1. set progress.current_step
 *   2. execute it with the seed data overlaid by all earlier results,
 *      narrowed to the keys the step declares
 *   3. append it to completed_steps and merge its outputs, in one update
 *
 * A failing required step stops the pipeline and fails the job; results
 * of the steps before it stay in the record. The task always ends by
 * writing a terminal state unless the job was deleted while it ran.
 *
 * Cancellation is checked inside every store transition after the job is
 * marked running, so a cancel that was accepted while the job was live
 * always ends it as failed, even when the running step ignores the
 * interrupt. A failure always passes through running in its own update.
 */
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    public static final String CANCELLED_MESSAGE = "Cancelled";

    private final JobStore        store;
    private final StepRegistry    registry;
    private final ExecutorService stepWorkers;
    private final Duration        stepTimeout;
    private final MeterRegistry   meterRegistry;

    // Cancel flags of running pipelines, and of cancels that arrived before one started.
    private final Map<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    /**
     * @param stepWorkers pool used to enforce {@code stepTimeout}; unused when
     *                    the timeout is zero
     * @param stepTimeout per-step deadline, zero or negative to disable
     */
    public PipelineExecutor(JobStore store,
                            StepRegistry registry,
                            ExecutorService stepWorkers,
                            Duration stepTimeout,
                            MeterRegistry meterRegistry) {
        this.store         = store;
        this.registry      = registry;
        this.stepWorkers   = stepWorkers;
        this.stepTimeout   = stepTimeout == null ? Duration.ZERO : stepTimeout;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point: called on a job worker thread, once per job
    // ------------------------------------------------------------------

    public void run(String jobId, WorkflowType workflow, List<PipelineStep> steps, Map<String, Object> seeds) {
        AtomicBoolean cancelled = cancelFlags.computeIfAbsent(jobId, k -> new AtomicBoolean());
        MDC.put("jobId",    jobId);
        MDC.put("workflow", workflow.wireName());
        try {
            log.info("Starting {} pipeline for job {} ({} steps)",
                    workflow.wireName(), jobId, PipelineStep.countEnabled(steps));
            if (!advance(jobId, JobRecord::markRunning)) {
                return;
            }
            if (cancelled.get()) {
                throw new StepExecutionException(StepExecutionException.Kind.CANCELLED, null,
                        CANCELLED_MESSAGE);
            }

            Map<String, Object> available = new LinkedHashMap<>(seeds);
            for (PipelineStep step : steps) {
                String name = step.name();
                if (!step.enabled()) {
                    log.info("Skipping optional step '{}' for job {}", name, jobId);
                    continue;
                }
                MDC.put("step", name);
                if (!advance(jobId, guarded(cancelled, name, r -> r.beginStep(name)))) {
                    return;
                }

                Object output = invoke(jobId, step, StepInputs.select(available, step.inputKeys()));

                Map<String, Object> outputs = new LinkedHashMap<>();
                for (String key : step.outputKeys()) {
                    outputs.put(key, output);
                }
                // a step that ignored the interrupt must not get its output recorded
                if (!advance(jobId, guarded(cancelled, name, r -> r.completeStep(name, outputs)))) {
                    return;
                }
                available.putAll(outputs);
                log.info("Job {} completed step '{}'", jobId, name);
                MDC.remove("step");
            }

            if (advance(jobId, guarded(cancelled, null, JobRecord::complete))) {
                log.info("Job {} COMPLETED", jobId);
                finished(workflow, JobStatus.COMPLETED);
            }
        } catch (StepExecutionException e) {
            if (e.getKind() == StepExecutionException.Kind.CANCELLED) {
                log.warn("Job {} cancelled during step '{}'", jobId, e.getStepName());
                failJob(jobId, workflow, CANCELLED_MESSAGE);
            } else {
                log.error("Job {} FAILED at step '{}': {}", jobId, e.getStepName(), e.getMessage(), e);
                failJob(jobId, workflow, e.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Job {} aborted by an unexpected error: {}", jobId, e.getMessage(), e);
            failJob(jobId, workflow, "Pipeline error: " + e.getMessage());
        } finally {
            // Nothing must leave a live job behind in a non-terminal state.
            store.get(jobId)
                    .filter(r -> !r.isTerminal())
                    .ifPresent(r -> failJob(jobId, workflow, "Pipeline stopped unexpectedly"));
            cancelFlags.remove(jobId, cancelled);
            MDC.clear();
        }
    }

    /**
     * Flag a job's pipeline for cancellation. A running pipeline fails the job
     * with {@value #CANCELLED_MESSAGE} at its next transition; one that has not
     * started yet does so right after marking the job running.
     *
     * <p>Callers that must not race the pipeline's own transitions invoke this
     * from inside a {@link JobStore#update} mutator of the same job.
     *
     * @return true if a pipeline was already running for the job
     */
    public boolean requestCancel(String jobId) {
        AtomicBoolean pending = new AtomicBoolean(true);
        AtomicBoolean running = cancelFlags.putIfAbsent(jobId, pending);
        if (running == null) {
            return false;
        }
        running.set(true);
        return true;
    }

    /**
     * Fail a job whose pipeline will never run, e.g. because its task was
     * withdrawn from the worker pool. Counted like a pipeline failure.
     */
    public void failUnstarted(String jobId, WorkflowType workflow, String reason) {
        try {
            failJob(jobId, workflow, reason);
        } finally {
            cancelFlags.remove(jobId);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Object invoke(String jobId, PipelineStep step, StepInputs inputs) {
        String name = step.name();
        StepExecutionContext ctx = new StepExecutionContext(jobId, name);
        log.info("Job {} running step '{}' with inputs {}", jobId, name, inputs.asMap().keySet());

        Object output;
        if (stepTimeout.isZero() || stepTimeout.isNegative()) {
            output = registry.execute(name, inputs, ctx);
        } else {
            output = invokeWithDeadline(name, inputs, ctx);
        }
        if (output == null) {
            throw new StepExecutionException(StepExecutionException.Kind.ERROR, name,
                    "Step '" + name + "' returned no output");
        }
        return output;
    }

    private Object invokeWithDeadline(String name, StepInputs inputs, StepExecutionContext ctx) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<Object> future = stepWorkers.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return registry.execute(name, inputs, ctx);
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepExecutionException(StepExecutionException.Kind.TIMEOUT, name,
                    "Step '" + name + "' timed out after " + stepTimeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepExecutionException(StepExecutionException.Kind.CANCELLED, name,
                    CANCELLED_MESSAGE, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof StepExecutionException se) {
                throw se;
            }
            throw new StepExecutionException(StepExecutionException.Kind.ERROR, name,
                    "Step '" + name + "' failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Wrap a transition so it refuses to run once the job was cancelled or
     * the worker thread interrupted. Checked under the store's per-job lock.
     */
    private static UnaryOperator<JobRecord> guarded(AtomicBoolean cancelled, String stepName,
                                                    UnaryOperator<JobRecord> transition) {
        return r -> {
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                throw new StepExecutionException(StepExecutionException.Kind.CANCELLED, stepName,
                        CANCELLED_MESSAGE);
            }
            return transition.apply(r);
        };
    }

    /**
     * Apply one transition. Returns false when the pipeline must stop
     * quietly: the job was deleted, or it already reached a terminal state
     * through cancellation.
     */
    private boolean advance(String jobId, UnaryOperator<JobRecord> transition) {
        try {
            if (store.update(jobId, transition)) {
                return true;
            }
            log.warn("Job {} was deleted while running; stopping its pipeline", jobId);
            return false;
        } catch (IllegalStateException e) {
            log.warn("Job {} rejected a transition, stopping its pipeline: {}", jobId, e.getMessage());
            return false;
        }
    }

    private void failJob(String jobId, WorkflowType workflow, String reason) {
        try {
            store.update(jobId, r -> r.status() == JobStatus.STARTED ? r.markRunning() : r);
            if (store.update(jobId, r -> r.fail(reason))) {
                finished(workflow, JobStatus.FAILED);
            }
        } catch (IllegalStateException e) {
            log.debug("Job {} already terminal, failure '{}' not recorded", jobId, reason);
        }
    }

    private void finished(WorkflowType workflow, JobStatus status) {
        meterRegistry.counter("meetprep.jobs.finished",
                "workflow", workflow.wireName(), "status", status.wireName()).increment();
    }
}
