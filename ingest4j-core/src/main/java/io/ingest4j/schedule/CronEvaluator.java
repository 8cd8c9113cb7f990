package io.ingest4j.schedule;

import java.time.Instant;

/**
 * Evaluates cron expressions for {@link RecurrencePolicy.Cron} schedules.
 */
public interface CronEvaluator {

    /**
     * @throws io.ingest4j.core.ConfigurationException if the expression cannot be parsed
     */
    void validate(String expression);

    /**
     * Next fire time strictly after {@code after}.
     */
    Instant nextAfter(String expression, Instant after);
}
