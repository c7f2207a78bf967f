package com.meetprep.orchestrator.store;

/**
 * Query, delete or cancel against a job id the store does not hold.
 */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
