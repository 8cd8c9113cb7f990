package io.ingest4j.core;

/**
 * Raised for deployment/configuration problems: unknown job names, malformed schedule entries,
 * missing recurrence fields, or a cron schedule without a cron evaluator.
 *
 * <p>Always fatal. The orchestrator never converts it into a failed job run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
