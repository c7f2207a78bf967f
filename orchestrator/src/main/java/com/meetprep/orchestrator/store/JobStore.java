package com.meetprep.orchestrator.store;

import com.meetprep.orchestrator.model.JobProgress;
import com.meetprep.orchestrator.model.JobRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Single source of truth for job state.
 *
 * Implementations must be safe for any number of concurrent callers.
 * Updates to one job id are serialized; updates to different ids are
 * independent.
 */
public interface JobStore {

    /** Create a STARTED record and return its new, never reused identifier. */
    String create(JobProgress progress);

    Optional<JobRecord> get(String id);

    /**
     * Apply one atomic transition to a job.
     *
     * The mutator receives the current snapshot and returns the next one; the
     * store stamps {@code updatedAt}. A mutator that returns the snapshot it
     * was given leaves the record untouched. If the mutator throws, the stored
     * snapshot is unchanged and the exception propagates.
     *
     * @return false if no job with this id exists
     */
    boolean update(String id, UnaryOperator<JobRecord> mutator);

    /** Snapshots of every retained job, oldest first. */
    List<JobRecord> list();

    boolean delete(String id);
}
