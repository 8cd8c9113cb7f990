package io.ingest4j.history;

import java.util.List;

/**
 * Append-only record of job lifecycle events. There is no update or delete.
 */
public interface HistoryLedger {

    /**
     * @return the sequence id assigned to the event
     * @throws io.ingest4j.core.StorageException on backend failure
     */
    long append(HistoryEvent event);

    /**
     * @return at most {@code limit} events, most recent first
     */
    List<HistoryEvent> recent(int limit);
}
