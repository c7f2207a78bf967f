package com.meetprep.orchestrator.service;

import com.meetprep.orchestrator.step.StepExecutionContext;
import com.meetprep.orchestrator.step.StepExecutionException;
import com.meetprep.orchestrator.step.StepInputs;
import com.meetprep.orchestrator.step.StepManifest;
import com.meetprep.orchestrator.step.StepRegistry;
import com.meetprep.orchestrator.step.UnknownStepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.meetprep.orchestrator.step.StepCatalog.*;

/**
 * Runs a single step synchronously on the caller's thread, outside any job.
 * Nothing is written to the job store; step metrics are still recorded.
 */
@Service
public class StepInvocationService {

    private static final Logger log = LoggerFactory.getLogger(StepInvocationService.class);

    private final StepRegistry registry;

    public StepInvocationService(StepRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param stepName registered name; hyphens are read as underscores, so
     *                 {@code people-research} runs {@code people_research}
     * @param inputs   seed data keyed like step results; keys the step does
     *                 not declare are ignored. May be null.
     * @throws UnknownStepException   if no such step is registered
     * @throws StepExecutionException if the step fails or returns nothing
     */
    public Object run(String stepName, Map<String, Object> inputs) {
        String name = stepName == null ? null : stepName.replace('-', '_');
        StepManifest manifest = registry.manifest(name);

        Map<String, Object> available = inputs == null ? Map.of() : inputs;
        StepInputs selected = StepInputs.select(available, manifest.inputKeys());
        log.info("Running step '{}' directly with inputs {}", name, selected.asMap().keySet());

        Object output = registry.execute(name, selected, new StepExecutionContext(null, name));
        if (output == null) {
            throw new StepExecutionException(StepExecutionException.Kind.ERROR, name,
                    "Step '" + name + "' returned no output");
        }
        return output;
    }

    /**
     * Build an agenda for one meeting without creating a job.
     *
     * @throws WorkflowValidationException if {@code focusMode} is not one of {@link com.meetprep.orchestrator.step.StepCatalog#FOCUS_MODES}
     */
    public Object quickAgenda(String focusMode, Map<String, Object> meetingContext) {
        if (!FOCUS_MODES.contains(focusMode)) {
            throw new WorkflowValidationException(
                    "Invalid focus mode '" + focusMode + "'. Expected one of " + FOCUS_MODES);
        }
        Map<String, Object> seeds = new LinkedHashMap<>();
        if (meetingContext != null) {
            seeds.put(MEETING_CONTEXT, meetingContext);
        }
        seeds.put(FOCUS_MODE, focusMode);
        return run(AGENDA_BUILDER, seeds);
    }
}
