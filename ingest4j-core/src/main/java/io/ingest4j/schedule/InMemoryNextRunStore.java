package io.ingest4j.schedule;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link NextRunStore}: state lives as long as the process.
 */
public class InMemoryNextRunStore implements NextRunStore {

    private final Map<String, ScheduleState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<ScheduleState> load(String jobId) {
        return Optional.ofNullable(states.get(jobId));
    }

    @Override
    public void save(ScheduleState state) {
        states.put(state.jobId(), state);
    }
}
