package io.ingest4j.schedule;

import io.ingest4j.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory set of enabled schedule entries.
 *
 * <p>{@link #dueJobs(Instant)} reads due-ness and advances next-run in one synchronized step,
 * so the returned jobs are already claimed: querying again right away will not return them.
 */
public class ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

    private final List<ScheduledJob> jobs;
    private final NextRunStore nextRunStore;

    public ScheduleStore(List<ScheduledJob> jobs, NextRunStore nextRunStore) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        this.nextRunStore = Objects.requireNonNull(nextRunStore, "nextRunStore must not be null");

        List<ScheduledJob> enabled = new ArrayList<>(jobs.size());
        Set<String> ids = new HashSet<>();
        for (ScheduledJob job : jobs) {
            if (!job.isEnabled()) {
                continue;
            }
            if (!ids.add(job.getId())) {
                throw new ConfigurationException("Duplicate schedule entry id: " + job.getId());
            }
            enabled.add(job);
        }

        for (ScheduledJob job : enabled) {
            for (String dep : job.getDependsOn()) {
                if (!ids.contains(dep)) {
                    log.warn("schedule entry depends on unknown or disabled job id={} dependsOn={}", job.getId(), dep);
                }
            }
        }
        DependencyOrder.requireAcyclic(enabled);

        this.jobs = List.copyOf(enabled);
        restoreNextRuns();
    }

    private void restoreNextRuns() {
        for (ScheduledJob job : jobs) {
            Optional<ScheduleState> state = nextRunStore.load(job.getId());
            if (state.isEmpty()) {
                continue;
            }
            ScheduleState s = state.get();
            if (s.nextRunAt() != null && job.getPolicy().describe().equals(s.policy())) {
                job.setNextRun(s.nextRunAt());
                log.debug("restored next run id={} nextRun={}", job.getId(), s.nextRunAt());
            } else {
                log.info("ignoring persisted next run for changed policy id={} stored={} current={}",
                        job.getId(), s.policy(), job.getPolicy().describe());
            }
        }
    }

    /**
     * Claim every job due at {@code now}: each returned job has its next-run advanced and persisted.
     *
     * @return due jobs in declaration order, adjusted so dependencies due in the same cycle come first
     */
    public synchronized List<ScheduledJob> dueJobs(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        List<ScheduledJob> ready = new ArrayList<>();
        for (ScheduledJob job : jobs) {
            if (job.isDue(now)) {
                ready.add(job);
            }
        }
        for (ScheduledJob job : ready) {
            job.markExecuted(now);
            nextRunStore.save(new ScheduleState(job.getId(), job.getPolicy().describe(), job.getNextRun(), now));
        }
        return DependencyOrder.order(ready);
    }

    public List<ScheduledJob> jobs() {
        return jobs;
    }

    public Optional<ScheduledJob> find(String id) {
        for (ScheduledJob job : jobs) {
            if (job.getId().equals(id)) {
                return Optional.of(job);
            }
        }
        return Optional.empty();
    }
}
