package com.meetprep.orchestrator.step.remote;

/**
 * Thrown when the research tool service returns an error or is unreachable.
 */
public class ResearchToolException extends RuntimeException {

    public ResearchToolException(String message) {
        super(message);
    }

    public ResearchToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
