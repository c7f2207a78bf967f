package com.meetprep.orchestrator.step;

/**
 * One named unit of research or synthesis work.
 *
 * Steps are external collaborators: the orchestrator only knows their
 * manifest and this execute contract, so a calendar lookup, a web search
 * or a summarizer can be swapped without touching the pipeline.
 *
 * <p>The returned value is opaque to the orchestrator and stored as-is under
 * every key in {@link StepManifest#outputKeys()}. A step may also return a
 * {@link java.util.concurrent.CompletionStage}; the registry awaits it.
 */
public interface ResearchStep {

    /** Identity, documentation and data-flow declaration. */
    StepManifest manifest();

    /**
     * Run the step.
     *
     * @param inputs only the keys declared in {@link StepManifest#inputKeys()}
     * @throws StepExecutionException on a controlled failure; any other
     *         exception is wrapped by the registry
     */
    Object execute(StepInputs inputs, StepExecutionContext ctx) throws Exception;
}
