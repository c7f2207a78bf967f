package com.meetprep.orchestrator.store;

import com.meetprep.orchestrator.model.JobProgress;
import com.meetprep.orchestrator.model.JobRecord;
import com.meetprep.orchestrator.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobStoreTest {

    private static JobProgress progress() {
        return JobProgress.initial(1, null, null);
    }

    // ------------------------------------------------------------------
    // create / get / delete
    // ------------------------------------------------------------------

    @Test
    void create_returnsStartedRecord() {
        InMemoryJobStore store = new InMemoryJobStore();
        String id = store.create(progress());

        assertThat(store.get(id)).hasValueSatisfying(r -> {
            assertThat(r.id()).isEqualTo(id);
            assertThat(r.status()).isEqualTo(JobStatus.STARTED);
        });
    }

    @Test
    void get_unknownOrNullId_isEmpty() {
        InMemoryJobStore store = new InMemoryJobStore();
        assertThat(store.get("nope")).isEmpty();
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    void delete_removesOnce() {
        InMemoryJobStore store = new InMemoryJobStore();
        String id = store.create(progress());

        assertThat(store.delete(id)).isTrue();
        assertThat(store.delete(id)).isFalse();
        assertThat(store.get(id)).isEmpty();
    }

    @Test
    void concurrentCreates_yieldDistinctIds() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        Set<String> ids = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> ids.add(store.create(progress()))));
            }
            for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(ids).hasSize(200);
        assertThat(store.list()).hasSize(200);
    }

    // ------------------------------------------------------------------
    // update
    // ------------------------------------------------------------------

    @Test
    void update_unknownId_returnsFalse() {
        InMemoryJobStore store = new InMemoryJobStore();
        assertThat(store.update("missing", JobRecord::markRunning)).isFalse();
    }

    @Test
    void update_mutatorThrows_leavesRecordUnchanged() {
        InMemoryJobStore store = new InMemoryJobStore();
        String id = store.create(progress());
        JobRecord before = store.get(id).orElseThrow();

        assertThatThrownBy(() -> store.update(id, JobRecord::complete))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.get(id)).containsSame(before);
    }

    @Test
    void update_sameSnapshot_isNoOp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        InMemoryJobStore store = new InMemoryJobStore(clock);
        String id = store.create(progress());
        JobRecord before = store.get(id).orElseThrow();

        clock.set(Instant.parse("2025-01-01T01:00:00Z"));
        assertThat(store.update(id, r -> r)).isTrue();

        assertThat(store.get(id)).containsSame(before);
    }

    @Test
    void update_updatedAtNeverMovesBackwards() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T12:00:00Z"));
        InMemoryJobStore store = new InMemoryJobStore(clock);
        String id = store.create(progress());

        clock.set(Instant.parse("2025-01-01T11:00:00Z"));
        store.update(id, JobRecord::markRunning);

        JobRecord r = store.get(id).orElseThrow();
        assertThat(r.updatedAt()).isEqualTo(Instant.parse("2025-01-01T12:00:00Z"));
        assertThat(r.updatedAt()).isAfterOrEqualTo(r.createdAt());
    }

    @Test
    void concurrentUpdates_sameJob_noneLost() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        String id = store.create(JobProgress.initial(100, null, null));
        store.update(id, JobRecord::markRunning);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String step = "step-" + i;
                Callable<Boolean> task = () -> {
                    go.await();
                    return store.update(id, r -> r.completeStep(step, Map.of(step, "out")));
                };
                futures.add(pool.submit(task));
            }
            go.countDown();
            for (Future<Boolean> f : futures) assertThat(f.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        JobRecord r = store.get(id).orElseThrow();
        assertThat(r.progress().completedSteps()).hasSize(100).doesNotHaveDuplicates();
        assertThat(r.results()).hasSize(100);
    }

    // ------------------------------------------------------------------
    // list
    // ------------------------------------------------------------------

    @Test
    void list_isOldestFirst() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        InMemoryJobStore store = new InMemoryJobStore(clock);
        String first = store.create(progress());
        clock.set(Instant.parse("2025-01-01T00:00:05Z"));
        String second = store.create(progress());

        assertThat(store.list()).extracting(JobRecord::id).containsExactly(first, second);
    }
}
