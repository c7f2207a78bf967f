package com.meetprep.orchestrator.step;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Mapping from step name to executable step.
 *
 * Built once at startup from the configured {@link StepProvider} and never
 * mutated afterwards, so lookups need no synchronization.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by name ({@link #get}, {@link #contains}).</li>
 *   <li>Metrics-instrumented execution ({@link #execute}): every call is
 *       timed and counted, and every failure surfaces as a
 *       {@link StepExecutionException}.</li>
 * </ol>
 */
public class StepRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private final Map<String, ResearchStep> steps;
    private final MeterRegistry meterRegistry;

    public StepRegistry(List<ResearchStep> allSteps, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Map<String, ResearchStep> byName = new LinkedHashMap<>();
        for (ResearchStep step : allSteps) {
            String name = step.manifest().name();
            if (byName.putIfAbsent(name, step) != null) {
                throw new IllegalStateException("Duplicate step registration: '" + name + "'");
            }
            log.info("Registered step '{}' reads={} writes={}",
                    name, step.manifest().inputKeys(), step.manifest().outputKeys());
        }
        this.steps = Collections.unmodifiableMap(byName);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public ResearchStep get(String name) {
        ResearchStep step = name == null ? null : steps.get(name);
        if (step == null) {
            throw new UnknownStepException(name);
        }
        return step;
    }

    public boolean contains(String name) {
        return name != null && steps.containsKey(name);
    }

    public StepManifest manifest(String name) {
        return get(name).manifest();
    }

    /** Returns all registered step names (sorted). */
    public List<String> stepNames() {
        return steps.keySet().stream().sorted().toList();
    }

    public List<StepManifest> manifests() {
        return steps.values().stream()
                .map(ResearchStep::manifest)
                .sorted(Comparator.comparing(StepManifest::name))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named step and await its value.
     *
     * <pre>
     *   meetprep.step.calls{step, status="success|error|timeout|cancelled"}
     *   meetprep.step.duration{step}
     * </pre>
     *
     * @throws StepExecutionException on any failure of the step
     * @throws UnknownStepException   if the name is not registered
     */
    public Object execute(String stepName, StepInputs inputs, StepExecutionContext ctx) {
        ResearchStep step = get(stepName);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            Object result = step.execute(inputs, ctx);
            if (result instanceof CompletionStage<?> stage) {
                result = stage.toCompletableFuture().get();
            }
            return result;
        } catch (StepExecutionException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = "cancelled";
            throw new StepExecutionException(StepExecutionException.Kind.CANCELLED, stepName,
                    "Step '" + stepName + "' was interrupted", e);
        } catch (ExecutionException e) {
            status = "error";
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof StepExecutionException se) {
                throw se;
            }
            throw new StepExecutionException(StepExecutionException.Kind.ERROR, stepName,
                    "Step '" + stepName + "' failed: " + cause.getMessage(), cause);
        } catch (Exception e) {
            status = "error";
            throw new StepExecutionException(StepExecutionException.Kind.ERROR, stepName,
                    "Step '" + stepName + "' failed: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("meetprep.step.duration", "step", stepName));
            meterRegistry.counter("meetprep.step.calls",
                    "step", stepName, "status", status).increment();
        }
    }
}
