package io.ingest4j.core;

import io.ingest4j.IngestionJob;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of job callables, built once at start-up.
 */
public class JobRegistry {

    private final Map<String, IngestionJob> jobsByName;

    public JobRegistry(List<? extends IngestionJob> jobs) {
        this.jobsByName = jobs.stream()
                .collect(Collectors.toUnmodifiableMap(
                        IngestionJob::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new ConfigurationException("Duplicate IngestionJob name: " + a.name());
                        }
                ));
    }

    public IngestionJob getRequired(String name) {
        IngestionJob job = jobsByName.get(name);
        if (job == null) {
            throw new ConfigurationException("No IngestionJob registered for name: " + name);
        }
        return job;
    }

    public boolean contains(String name) {
        return jobsByName.containsKey(name);
    }

    public Set<String> names() {
        return jobsByName.keySet();
    }
}
