package com.meetprep.orchestrator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Progress section of a job record.
 *
 * @param currentStep    step being executed right now, null when idle or terminal
 * @param completedSteps append-only, in execution order, no duplicates
 * @param totalSteps     number of steps enabled for the job, fixed at creation
 * @param requestedSteps explicit subset for custom workflows, null otherwise
 * @param focusMode      agenda focus for agenda workflows, null otherwise
 */
public record JobProgress(
        String       currentStep,
        List<String> completedSteps,
        int          totalSteps,
        List<String> requestedSteps,
        String       focusMode
) {
    public JobProgress {
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        requestedSteps = requestedSteps == null ? null : List.copyOf(requestedSteps);
    }

    public static JobProgress initial(int totalSteps, List<String> requestedSteps, String focusMode) {
        return new JobProgress(null, List.of(), totalSteps, requestedSteps, focusMode);
    }

    JobProgress withCurrentStep(String step) {
        return new JobProgress(step, completedSteps, totalSteps, requestedSteps, focusMode);
    }

    JobProgress withCompleted(String step) {
        List<String> done = new ArrayList<>(completedSteps);
        done.add(step);
        return new JobProgress(null, done, totalSteps, requestedSteps, focusMode);
    }

    /**
     * Workflow shape inferred from which progress fields are populated.
     */
    public WorkflowType workflowType() {
        if (requestedSteps != null) return WorkflowType.CUSTOM;
        if (focusMode != null)      return WorkflowType.AGENDA;
        return WorkflowType.FULL;
    }
}
