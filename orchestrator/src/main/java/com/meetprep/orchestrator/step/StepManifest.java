package com.meetprep.orchestrator.step;

import java.util.List;

/**
 * Identity and data-flow contract for a research step.
 *
 * @param name        Unique identifier used in registry lookups, custom
 *                    workflow requests and progress.completed_steps.
 * @param description One sentence shown by GET /steps.
 * @param inputKeys   Result or seed keys this step reads, in the order it uses them.
 * @param outputKeys  Result keys this step writes; no two steps of a workflow
 *                    may share one.
 */
public record StepManifest(
        String       name,
        String       description,
        List<String> inputKeys,
        List<String> outputKeys) {

    public StepManifest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name is required");
        }
        inputKeys  = inputKeys == null ? List.of() : List.copyOf(inputKeys);
        outputKeys = outputKeys == null || outputKeys.isEmpty()
                ? List.of(name)
                : List.copyOf(outputKeys);
    }
}
