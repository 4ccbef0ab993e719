package com.logsentinel.core.port;

import com.logsentinel.core.model.LogEntry;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Data-access collaborator that supplies log batches to agents.
 *
 * <p>
 * The core never opens storage connections of its own; every batch comes
 * through this interface.
 * </p>
 */
public interface LogSource {

    /**
     * Fetch the log records written within {@code [windowStart, windowEnd]}.
     *
     * @param sourceFilters program names to include; an empty set means all
     *                      sources
     * @param windowStart   inclusive lower bound
     * @param windowEnd     inclusive upper bound
     * @return matching records, never {@code null}
     * @throws IOException if the backing store cannot be read
     */
    List<LogEntry> fetchLogs(Set<String> sourceFilters, Instant windowStart, Instant windowEnd)
            throws IOException;
}
