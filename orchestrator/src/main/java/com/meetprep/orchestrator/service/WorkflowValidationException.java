package com.meetprep.orchestrator.service;

/**
 * A workflow request was rejected before any job was created.
 */
public class WorkflowValidationException extends RuntimeException {
    public WorkflowValidationException(String message) {
        super(message);
    }
}
