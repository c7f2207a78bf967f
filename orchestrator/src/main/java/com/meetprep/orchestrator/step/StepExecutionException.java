package com.meetprep.orchestrator.step;

/**
 * A named step failed during a run.
 *
 * Unchecked: the pipeline catches it at the job boundary and turns it into
 * {@code status=failed} with the message as the job's error.
 */
public class StepExecutionException extends RuntimeException {

    public enum Kind { ERROR, TIMEOUT, CANCELLED }

    private final Kind   kind;
    private final String stepName;

    public StepExecutionException(Kind kind, String stepName, String message) {
        super(message);
        this.kind     = kind;
        this.stepName = stepName;
    }

    public StepExecutionException(Kind kind, String stepName, String message, Throwable cause) {
        super(message, cause);
        this.kind     = kind;
        this.stepName = stepName;
    }

    public Kind   getKind()     { return kind; }
    public String getStepName() { return stepName; }
}
