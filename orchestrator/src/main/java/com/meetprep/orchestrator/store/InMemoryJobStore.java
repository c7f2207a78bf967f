package com.meetprep.orchestrator.store;

import com.meetprep.orchestrator.model.JobProgress;
import com.meetprep.orchestrator.model.JobRecord;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-lifetime, in-memory {@link JobStore}.
 *
 * Records are immutable snapshots held in a {@link ConcurrentHashMap}.
 * {@code update} runs the mutator inside {@code computeIfPresent}, which locks
 * the single entry, so two transitions of the same job never interleave while
 * other jobs are untouched. Readers get whichever snapshot is current and
 * never block on a running pipeline.
 */
public final class InMemoryJobStore implements JobStore {

    private final Map<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String create(JobProgress progress) {
        Instant now = clock.instant();
        while (true) {
            String id = UUID.randomUUID().toString();
            if (jobs.putIfAbsent(id, JobRecord.started(id, progress, now)) == null) {
                return id;
            }
        }
    }

    @Override
    public Optional<JobRecord> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(jobs.get(id));
    }

    @Override
    public boolean update(String id, UnaryOperator<JobRecord> mutator) {
        if (id == null) return false;
        JobRecord updated = jobs.computeIfPresent(id, (key, current) -> {
            JobRecord next = mutator.apply(current);
            if (next == current) {
                return current;
            }
            // updated_at never moves backwards, even if the clock does
            Instant now = clock.instant();
            Instant stamp = now.isAfter(current.updatedAt()) ? now : current.updatedAt();
            return next.withUpdatedAt(stamp);
        });
        return updated != null;
    }

    @Override
    public List<JobRecord> list() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(JobRecord::createdAt).thenComparing(JobRecord::id))
                .toList();
    }

    @Override
    public boolean delete(String id) {
        return id != null && jobs.remove(id) != null;
    }
}
