package com.meetprep.orchestrator.service;

import com.meetprep.orchestrator.model.JobRecord;
import com.meetprep.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic eviction of finished jobs.
 *
 * Two independent limits, both off by default:
 *   meetprep.jobs.retention    : terminal jobs last updated longer ago are removed
 *   meetprep.jobs.max-retained : beyond this many terminal jobs, the oldest go first
 *
 * Jobs that are started or running are never evicted.
 */
@Component
@EnableScheduling
public class JobRetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(JobRetentionSweeper.class);

    private final JobStore store;
    private final Clock    clock;
    private final Duration retention;
    private final int      maxRetained;

    public JobRetentionSweeper(JobStore store,
                               Clock clock,
                               @Value("${meetprep.jobs.retention:PT0S}") Duration retention,
                               @Value("${meetprep.jobs.max-retained:0}") int maxRetained) {
        this.store       = store;
        this.clock       = clock;
        this.retention   = retention;
        this.maxRetained = maxRetained;
    }

    @Scheduled(fixedDelayString = "${meetprep.jobs.sweep-interval-ms:60000}")
    public void tick() {
        int evicted = sweep();
        if (evicted > 0) {
            log.info("Retention sweep evicted {} job(s)", evicted);
        }
    }

    /** Run one sweep and return the number of jobs removed. */
    public int sweep() {
        if (!isEnabled()) {
            return 0;
        }
        int evicted = 0;

        if (!retention.isZero() && !retention.isNegative()) {
            Instant cutoff = clock.instant().minus(retention);
            for (JobRecord r : store.list()) {
                if (r.isTerminal() && r.updatedAt().isBefore(cutoff) && store.delete(r.id())) {
                    log.debug("Evicted job {} (last updated {})", r.id(), r.updatedAt());
                    evicted++;
                }
            }
        }

        if (maxRetained > 0) {
            // list() is oldest first
            List<JobRecord> terminal = store.list().stream().filter(JobRecord::isTerminal).toList();
            for (int i = 0; i < terminal.size() - maxRetained; i++) {
                if (store.delete(terminal.get(i).id())) {
                    evicted++;
                }
            }
        }
        return evicted;
    }

    private boolean isEnabled() {
        return maxRetained > 0 || !(retention.isZero() || retention.isNegative());
    }
}
