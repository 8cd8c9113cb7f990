package io.ingest4j.schedule;

import io.ingest4j.core.ConfigurationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * {@link CronEvaluator} backed by Quartz {@link CronExpression}.
 * <p>
 * Accepted formats:
 * <ul>
 *   <li>5-field crontab ("0 2 * * *"): a seconds field of {@code 0} is prepended and numeric
 *   weekdays (0 or 7 = Sunday) are renumbered to Quartz's 1 = Sunday</li>
 *   <li>6/7-field Quartz expressions, used as is (after the day-of-week "?" fix-up)</li>
 * </ul>
 */
public final class QuartzCronEvaluator implements CronEvaluator {

    private final ZoneId zone;

    public QuartzCronEvaluator() {
        this(ZoneOffset.UTC);
    }

    public QuartzCronEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public void validate(String expression) {
        toCronExpression(expression);
    }

    @Override
    public Instant nextAfter(String expression, Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        CronExpression exp = toCronExpression(expression);
        Date next = exp.getNextValidTimeAfter(Date.from(after));
        if (next == null) {
            throw new ConfigurationException("Cron expression produced no next execution time: " + expression);
        }
        return next.toInstant();
    }

    private CronExpression toCronExpression(String expression) {
        String cron = normalizeCron(expression);
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new ConfigurationException("Invalid cron expression: " + expression, ex);
        }
    }

    /**
     * Normalize crontab-style expressions to Quartz syntax.
     */
    static String normalizeCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Cron expression must not be empty");
        }

        String[] parts = expression.trim().split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], toQuartzDayOfWeek(parts[4]));
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return expression.trim();
    }

    /**
     * Crontab weekdays run 0-7 with Sunday at both ends; Quartz runs 1-7 starting at Sunday.
     * Numeric fields (lists, ranges, steps) are expanded and emitted as a Quartz list.
     * Names, '*' and '?' pass through.
     */
    static String toQuartzDayOfWeek(String field) {
        if ("*".equals(field) || "?".equals(field) || !field.matches("[0-9*,/-]+")) {
            return field;
        }
        TreeSet<Integer> days = new TreeSet<>();
        try {
            for (String part : field.split(",", -1)) {
                String range = part;
                int step = 1;
                int slash = part.indexOf('/');
                if (slash >= 0) {
                    range = part.substring(0, slash);
                    step = Integer.parseInt(part.substring(slash + 1));
                }
                int from;
                int to;
                if ("*".equals(range)) {
                    from = 0;
                    to = 6;
                } else if (range.contains("-")) {
                    String[] bounds = range.split("-", -1);
                    if (bounds.length != 2) {
                        throw new ConfigurationException("Invalid day-of-week field: " + field);
                    }
                    from = Integer.parseInt(bounds[0]);
                    to = Integer.parseInt(bounds[1]);
                } else {
                    from = Integer.parseInt(range);
                    to = slash >= 0 ? 7 : from;
                }
                if (from < 0 || to > 7 || from > to || step < 1) {
                    throw new ConfigurationException("Invalid day-of-week field: " + field);
                }
                for (int day = from; day <= to; day += step) {
                    days.add(day % 7 + 1);
                }
            }
        } catch (NumberFormatException ex) {
            throw new ConfigurationException("Invalid day-of-week field: " + field, ex);
        }
        return days.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    // Quartz rejects '*' in both day-of-month and day-of-week.
    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dom) && "*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else if ("*".equals(dow)) {
            dow = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }
}
