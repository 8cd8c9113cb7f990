package io.ingest4j.schedule;

import io.ingest4j.core.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecurrencePolicyTest {

    // 2026-01-05 is a Monday
    private static final Instant MONDAY_0800 = Instant.parse("2026-01-05T08:00:00Z");

    @Test
    void intervalAddsSecondsToNow() {
        RecurrencePolicy policy = new RecurrencePolicy.Interval(300);
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), policy.nextRunAfter(now));
    }

    @Test
    void intervalRejectsNonPositiveSeconds() {
        assertThrows(ConfigurationException.class, () -> new RecurrencePolicy.Interval(0));
        assertThrows(ConfigurationException.class, () -> new RecurrencePolicy.Interval(-5));
    }

    @Test
    void dailyBeforeTimeOfDayRunsSameDay() {
        RecurrencePolicy policy = new RecurrencePolicy.Daily(LocalTime.of(2, 0));

        assertEquals(Instant.parse("2026-03-10T02:00:00Z"), policy.nextRunAfter(Instant.parse("2026-03-10T01:00:00Z")));
    }

    @Test
    void dailyAfterTimeOfDayRunsNextDay() {
        RecurrencePolicy policy = new RecurrencePolicy.Daily(LocalTime.of(2, 0));

        assertEquals(Instant.parse("2026-03-11T02:00:00Z"), policy.nextRunAfter(Instant.parse("2026-03-10T03:00:00Z")));
    }

    @Test
    void dailyAtExactTimeCountsAsPassed() {
        RecurrencePolicy policy = new RecurrencePolicy.Daily(LocalTime.of(2, 0));

        assertEquals(Instant.parse("2026-03-11T02:00:00Z"), policy.nextRunAfter(Instant.parse("2026-03-10T02:00:00Z")));
    }

    @Test
    void dailyRollsOverMonthEnd() {
        RecurrencePolicy policy = new RecurrencePolicy.Daily(LocalTime.of(6, 30));

        assertEquals(Instant.parse("2026-03-01T06:30:00Z"), policy.nextRunAfter(Instant.parse("2026-02-28T23:00:00Z")));
    }

    @Test
    void weeklyOnSameWeekdayBeforeTimeRunsSameDay() {
        RecurrencePolicy policy = new RecurrencePolicy.Weekly(DayOfWeek.MONDAY, LocalTime.of(9, 0));

        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), policy.nextRunAfter(MONDAY_0800));
    }

    @Test
    void weeklyOnSameWeekdayAfterTimeRunsNextWeek() {
        RecurrencePolicy policy = new RecurrencePolicy.Weekly(DayOfWeek.MONDAY, LocalTime.of(9, 0));

        assertEquals(Instant.parse("2026-01-12T09:00:00Z"), policy.nextRunAfter(Instant.parse("2026-01-05T10:00:00Z")));
    }

    @Test
    void weeklyFromEarlierWeekdayRunsLaterThisWeek() {
        RecurrencePolicy policy = new RecurrencePolicy.Weekly(DayOfWeek.FRIDAY, LocalTime.of(18, 0));

        assertEquals(Instant.parse("2026-01-09T18:00:00Z"), policy.nextRunAfter(MONDAY_0800));
    }

    @Test
    void weeklyFromLaterWeekdayWrapsToNextWeek() {
        RecurrencePolicy policy = new RecurrencePolicy.Weekly(DayOfWeek.MONDAY, LocalTime.of(9, 0));

        // Wednesday
        assertEquals(Instant.parse("2026-01-12T09:00:00Z"), policy.nextRunAfter(Instant.parse("2026-01-07T12:00:00Z")));
    }

    @Test
    void nextRunIsPureFunctionOfPolicyAndNow() {
        RecurrencePolicy policy = new RecurrencePolicy.Weekly(DayOfWeek.SUNDAY, LocalTime.of(23, 59));
        Instant now = Instant.parse("2026-06-01T12:00:00Z");

        assertEquals(policy.nextRunAfter(now), policy.nextRunAfter(now));
    }

    @Test
    void cronDelegatesToEvaluator() {
        RecurrencePolicy policy = new RecurrencePolicy.Cron("*/15 * * * *", new QuartzCronEvaluator());

        assertEquals(Instant.parse("2026-01-01T00:15:00Z"), policy.nextRunAfter(Instant.parse("2026-01-01T00:01:00Z")));
    }

    @Test
    void cronWithoutEvaluatorIsConfigurationError() {
        RecurrencePolicy policy = new RecurrencePolicy.Cron("0 0 * * *", null);

        assertThrows(ConfigurationException.class, () -> policy.nextRunAfter(MONDAY_0800));
    }

    @Test
    void describeIsStable() {
        assertEquals("interval 60s", new RecurrencePolicy.Interval(60).describe());
        assertEquals("daily 02:00", new RecurrencePolicy.Daily(LocalTime.of(2, 0)).describe());
        assertEquals("weekly monday 09:00", new RecurrencePolicy.Weekly(DayOfWeek.MONDAY, LocalTime.of(9, 0)).describe());
    }
}
