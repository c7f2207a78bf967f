package com.meetprep.orchestrator.pipeline;

import com.meetprep.orchestrator.step.StepManifest;

import java.util.List;

/**
 * A step as placed in one job's pipeline: its manifest plus whether the
 * workflow marked it optional and whether that option is switched on.
 *
 * A disabled optional step is skipped: it is not recorded as completed and
 * does not count towards total_steps.
 */
public record PipelineStep(StepManifest manifest, boolean optional, boolean enabled) {

    public PipelineStep {
        if (!optional && !enabled) {
            throw new IllegalArgumentException(
                    "Required step '" + manifest.name() + "' cannot be disabled");
        }
    }

    public static PipelineStep required(StepManifest manifest) {
        return new PipelineStep(manifest, false, true);
    }

    public static PipelineStep optional(StepManifest manifest, boolean enabled) {
        return new PipelineStep(manifest, true, enabled);
    }

    public String name()             { return manifest.name(); }
    public List<String> inputKeys()  { return manifest.inputKeys(); }
    public List<String> outputKeys() { return manifest.outputKeys(); }

    /** Steps that will actually be dispatched. */
    public static int countEnabled(List<PipelineStep> steps) {
        return (int) steps.stream().filter(PipelineStep::enabled).count();
    }
}
