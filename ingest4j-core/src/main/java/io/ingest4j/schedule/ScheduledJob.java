package io.ingest4j.schedule;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the schedule: which job to run, with which args, and when.
 *
 * <p>{@code id} identifies the entry (defaults to {@code name}); {@code name} identifies the
 * {@link io.ingest4j.IngestionJob} to invoke, so the same job can be scheduled twice with different args.
 */
public class ScheduledJob {

    private final String id;
    private final String name;
    private final Map<String, Object> args;
    private final RecurrencePolicy policy;
    private final String description;
    private final boolean enabled;
    private final List<String> dependsOn;

    private volatile Instant nextRun;

    public ScheduledJob(String id,
                        String name,
                        Map<String, Object> args,
                        RecurrencePolicy policy,
                        Instant nextRun,
                        String description,
                        boolean enabled,
                        List<String> dependsOn) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.id = id == null || id.isBlank() ? name : id;
        this.args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.nextRun = Objects.requireNonNull(nextRun, "nextRun must not be null");
        this.description = description == null ? "" : description;
        this.enabled = enabled;
        this.dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public Instant computeNextRun(Instant now) {
        return policy.nextRunAfter(now);
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(nextRun);
    }

    /**
     * Advance {@code nextRun} from {@code now}. Called exactly once per claim.
     */
    public void markExecuted(Instant now) {
        this.nextRun = computeNextRun(now);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public RecurrencePolicy getPolicy() {
        return policy;
    }

    public Instant getNextRun() {
        return nextRun;
    }

    void setNextRun(Instant nextRun) {
        this.nextRun = Objects.requireNonNull(nextRun, "nextRun must not be null");
    }

    public String getDescription() {
        return description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    @Override
    public String toString() {
        return "ScheduledJob{id=" + id + ", name=" + name + ", policy=" + policy.describe() + ", nextRun=" + nextRun + "}";
    }
}
