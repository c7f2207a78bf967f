package com.meetprep.orchestrator.service;

import com.meetprep.orchestrator.model.JobRecord;
import com.meetprep.orchestrator.model.JobSummary;
import com.meetprep.orchestrator.store.JobNotFoundException;
import com.meetprep.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the engine. Never blocks on a running pipeline: every call
 * returns whichever snapshot the store holds at that moment.
 */
@Service
public class JobQueryService {

    private static final Logger log = LoggerFactory.getLogger(JobQueryService.class);

    private final JobStore store;

    public JobQueryService(JobStore store) {
        this.store = store;
    }

    /**
     * @throws JobNotFoundException if the id is unknown or was deleted
     */
    public JobRecord getJob(String jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** Summaries of all retained jobs, oldest first. */
    public List<JobSummary> listJobs() {
        return store.list().stream()
                .map(JobSummary::from)
                .toList();
    }

    /**
     * Remove a job record. A pipeline still running for it notices on its
     * next transition and stops without writing anything further.
     *
     * @throws JobNotFoundException if the id is unknown
     */
    public void deleteJob(String jobId) {
        if (!store.delete(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Deleted job {}", jobId);
    }
}
