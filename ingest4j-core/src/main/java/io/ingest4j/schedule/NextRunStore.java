package io.ingest4j.schedule;

import java.util.Optional;

/**
 * Keeps each job's next-run across restarts so a restart does not make every job due at once.
 */
public interface NextRunStore {

    Optional<ScheduleState> load(String jobId);

    void save(ScheduleState state);
}
