package com.meetprep.orchestrator.store;

import com.meetprep.orchestrator.model.JobProgress;
import com.meetprep.orchestrator.model.JobRecord;
import com.meetprep.orchestrator.model.JobStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Store that remembers every status each job was stored with, in order, so
 * tests can check that no lifecycle state was skipped.
 */
public class StatusTrailStore implements JobStore {

    private final JobStore delegate;
    private final Map<String, List<JobStatus>> trails = new ConcurrentHashMap<>();

    public StatusTrailStore(JobStore delegate) {
        this.delegate = delegate;
    }

    public List<JobStatus> trail(String id) {
        List<JobStatus> trail = trails.get(id);
        if (trail == null) {
            return List.of();
        }
        synchronized (trail) {
            return List.copyOf(trail);
        }
    }

    @Override
    public String create(JobProgress progress) {
        String id = delegate.create(progress);
        trails.put(id, new ArrayList<>(List.of(JobStatus.STARTED)));
        return id;
    }

    @Override
    public Optional<JobRecord> get(String id) {
        return delegate.get(id);
    }

    @Override
    public boolean update(String id, UnaryOperator<JobRecord> mutator) {
        return delegate.update(id, current -> {
            JobRecord next = mutator.apply(current);
            if (next != current && next.status() != current.status()) {
                List<JobStatus> trail = trails.computeIfAbsent(id, k -> new ArrayList<>());
                synchronized (trail) {
                    trail.add(next.status());
                }
            }
            return next;
        });
    }

    @Override
    public List<JobRecord> list() {
        return delegate.list();
    }

    @Override
    public boolean delete(String id) {
        return delegate.delete(id);
    }
}
