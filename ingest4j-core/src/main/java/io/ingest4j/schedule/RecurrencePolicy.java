package io.ingest4j.schedule;

import io.ingest4j.core.ConfigurationException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;

/**
 * How a scheduled job recurs. All calendar arithmetic is done in UTC.
 *
 * <p>{@link #nextRunAfter(Instant)} is a pure function of the policy and {@code now}.
 */
public sealed interface RecurrencePolicy
        permits RecurrencePolicy.Interval, RecurrencePolicy.Daily, RecurrencePolicy.Weekly, RecurrencePolicy.Cron {

    Instant nextRunAfter(Instant now);

    /**
     * Stable textual form, used to tell whether a persisted next-run still belongs to this policy.
     */
    String describe();

    record Interval(long seconds) implements RecurrencePolicy {
        public static final long DEFAULT_SECONDS = 300;

        public Interval {
            if (seconds <= 0) {
                throw new ConfigurationException("interval seconds must be positive: " + seconds);
            }
        }

        @Override
        public Instant nextRunAfter(Instant now) {
            return now.plusSeconds(seconds);
        }

        @Override
        public String describe() {
            return "interval " + seconds + "s";
        }
    }

    /**
     * Once per day at {@code timeOfDay}. An instant equal to {@code now} counts as passed.
     */
    record Daily(LocalTime timeOfDay) implements RecurrencePolicy {
        public Daily {
            Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        }

        @Override
        public Instant nextRunAfter(Instant now) {
            ZonedDateTime base = now.atZone(ZoneOffset.UTC);
            ZonedDateTime candidate = base.toLocalDate().atTime(timeOfDay).atZone(ZoneOffset.UTC);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1);
            }
            return candidate.toInstant();
        }

        @Override
        public String describe() {
            return "daily " + timeOfDay;
        }
    }

    /**
     * Once per week on {@code weekday} at {@code timeOfDay}.
     */
    record Weekly(DayOfWeek weekday, LocalTime timeOfDay) implements RecurrencePolicy {
        public Weekly {
            Objects.requireNonNull(weekday, "weekday must not be null");
            Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        }

        @Override
        public Instant nextRunAfter(Instant now) {
            ZonedDateTime base = now.atZone(ZoneOffset.UTC);
            int daysAhead = Math.floorMod(weekday.getValue() - base.getDayOfWeek().getValue(), 7);
            LocalDate date = base.toLocalDate().plusDays(daysAhead);
            ZonedDateTime candidate = date.atTime(timeOfDay).atZone(ZoneOffset.UTC);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(7);
            }
            return candidate.toInstant();
        }

        @Override
        public String describe() {
            return "weekly " + weekday.name().toLowerCase(Locale.ROOT) + " " + timeOfDay;
        }
    }

    /**
     * Cron expression, evaluated by the supplied {@link CronEvaluator}.
     *
     * @param evaluator may be null only for policies that are never evaluated;
     *                  {@link #nextRunAfter(Instant)} then fails with {@link ConfigurationException}
     */
    record Cron(String expression, CronEvaluator evaluator) implements RecurrencePolicy {
        public static final String DEFAULT_EXPRESSION = "0 0 * * *";

        public Cron {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public Instant nextRunAfter(Instant now) {
            if (evaluator == null) {
                throw new ConfigurationException("No cron evaluator configured for cron schedule: " + expression);
            }
            return evaluator.nextAfter(expression, now);
        }

        @Override
        public String describe() {
            return "cron " + expression;
        }
    }
}
