package io.ingest4j.schedule;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ingest4j.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Parses the declarative schedule document into a {@link ScheduleStore}.
 *
 * <pre>
 * {
 *   "jobs": [
 *     {
 *       "name": "fetch_transactions",
 *       "args": { "limit": 5 },
 *       "schedule": { "type": "daily", "time": "02:00" },
 *       "description": "nightly transaction pull",
 *       "enabled": true,
 *       "depends_on": ["update_region_codes"]
 *     }
 *   ]
 * }
 * </pre>
 *
 * <p>Schedule types: {@code interval} ({@code seconds}, default 300), {@code daily} ({@code time}),
 * {@code weekly} ({@code weekday}, {@code time}) and {@code cron} ({@code expression}).
 * A missing {@code schedule} means {@code {"type": "interval", "seconds": 300}}.
 * Disabled entries are skipped before validation.
 */
public class ScheduleLoader {
    private static final Logger log = LoggerFactory.getLogger(ScheduleLoader.class);
    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("H:mm[:ss]");

    private final ObjectMapper objectMapper;
    private final CronEvaluator cronEvaluator;
    private final NextRunStore nextRunStore;

    /**
     * @param cronEvaluator may be null; any enabled cron entry then fails to load
     */
    public ScheduleLoader(ObjectMapper objectMapper, CronEvaluator cronEvaluator, NextRunStore nextRunStore) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.cronEvaluator = cronEvaluator;
        this.nextRunStore = Objects.requireNonNull(nextRunStore, "nextRunStore must not be null");
    }

    public ScheduleStore load(Path path, Instant now) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            ScheduleStore store = load(in, now);
            log.info("Loaded schedule from {} jobs={}", path, store.jobs().size());
            return store;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read schedule file: " + path, e);
        }
    }

    /**
     * @param now initial next-run of entries without persisted state (they are due immediately)
     */
    public ScheduleStore load(InputStream source, Instant now) {
        return new ScheduleStore(parse(source, now), nextRunStore);
    }

    public List<ScheduledJob> parse(InputStream source, Instant now) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(now, "now must not be null");

        JsonNode root;
        try {
            root = objectMapper.readTree(source);
        } catch (IOException e) {
            throw new ConfigurationException("Schedule source is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Schedule source must be a JSON object with a 'jobs' array");
        }

        JsonNode entries = root.path("jobs");
        if (entries.isMissingNode() || entries.isNull()) {
            return List.of();
        }
        if (!entries.isArray()) {
            throw new ConfigurationException("'jobs' must be an array");
        }

        List<ScheduledJob> jobs = new ArrayList<>(entries.size());
        int index = 0;
        for (JsonNode entry : entries) {
            ScheduledJob job = parseEntry(entry, index++, now);
            if (job != null) {
                jobs.add(job);
            }
        }
        return jobs;
    }

    private ScheduledJob parseEntry(JsonNode entry, int index, Instant now) {
        if (!entry.isObject()) {
            throw new ConfigurationException("jobs[" + index + "] must be an object");
        }
        if (!entry.path("enabled").asBoolean(true)) {
            log.debug("skipping disabled schedule entry index={} name={}", index, entry.path("name").asText(null));
            return null;
        }

        String name = entry.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("jobs[" + index + "] is missing required field 'name'");
        }
        String id = entry.path("id").asText(name);

        JsonNode argsNode = entry.path("args");
        Map<String, Object> args;
        if (argsNode.isMissingNode() || argsNode.isNull()) {
            args = Map.of();
        } else if (argsNode.isObject()) {
            args = objectMapper.convertValue(argsNode, new TypeReference<>() {
            });
        } else {
            throw new ConfigurationException("jobs[" + index + "].args must be an object: " + id);
        }

        RecurrencePolicy policy = parsePolicy(entry.path("schedule"), id);

        List<String> dependsOn = new ArrayList<>();
        JsonNode deps = entry.path("depends_on");
        if (deps.isArray()) {
            for (JsonNode dep : deps) {
                dependsOn.add(dep.asText());
            }
        } else if (!deps.isMissingNode() && !deps.isNull()) {
            throw new ConfigurationException("jobs[" + index + "].depends_on must be an array: " + id);
        }

        return new ScheduledJob(
                id,
                name,
                args,
                policy,
                now,
                entry.path("description").asText(""),
                true,
                dependsOn
        );
    }

    RecurrencePolicy parsePolicy(JsonNode schedule, String jobId) {
        if (schedule.isMissingNode() || schedule.isNull()) {
            return new RecurrencePolicy.Interval(RecurrencePolicy.Interval.DEFAULT_SECONDS);
        }
        if (!schedule.isObject()) {
            throw new ConfigurationException("schedule must be an object: " + jobId);
        }

        String type = schedule.path("type").asText("interval").toLowerCase(Locale.ROOT);
        return switch (type) {
            case "interval" -> {
                JsonNode seconds = schedule.path("seconds");
                if (seconds.isMissingNode() || seconds.isNull()) {
                    yield new RecurrencePolicy.Interval(RecurrencePolicy.Interval.DEFAULT_SECONDS);
                }
                if (seconds.isTextual() && seconds.asText().trim().matches("^\\d+$")) {
                    yield new RecurrencePolicy.Interval(Long.parseLong(seconds.asText().trim()));
                }
                if (!seconds.isIntegralNumber() || !seconds.canConvertToLong()) {
                    throw new ConfigurationException("interval 'seconds' must be an integer: " + jobId);
                }
                yield new RecurrencePolicy.Interval(seconds.asLong());
            }
            case "daily" -> new RecurrencePolicy.Daily(requireTime(schedule, jobId));
            case "weekly" -> new RecurrencePolicy.Weekly(requireWeekday(schedule, jobId), requireTime(schedule, jobId));
            case "cron" -> {
                String expression = schedule.path("expression").asText(RecurrencePolicy.Cron.DEFAULT_EXPRESSION);
                if (cronEvaluator == null) {
                    throw new ConfigurationException("cron schedule requires a cron evaluator, none configured: " + jobId);
                }
                cronEvaluator.validate(expression);
                yield new RecurrencePolicy.Cron(expression, cronEvaluator);
            }
            default -> throw new ConfigurationException("Unknown schedule type '" + type + "': " + jobId);
        };
    }

    private static LocalTime requireTime(JsonNode schedule, String jobId) {
        String value = schedule.path("time").asText(null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("schedule is missing required field 'time': " + jobId);
        }
        try {
            return LocalTime.parse(value.trim(), TIME_OF_DAY);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid time '" + value + "', expected HH:mm: " + jobId, e);
        }
    }

    private static DayOfWeek requireWeekday(JsonNode schedule, String jobId) {
        String value = schedule.path("weekday").asText(null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("schedule is missing required field 'weekday': " + jobId);
        }
        try {
            return DayOfWeek.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid weekday '" + value + "': " + jobId, e);
        }
    }
}
