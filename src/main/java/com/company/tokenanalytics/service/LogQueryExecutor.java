package com.company.tokenanalytics.service;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs rendered query text against the event log.
 */
public interface LogQueryExecutor {

    /**
     * @param query    query text produced by the plan renderer
     * @param lookback how far back from now events are considered
     * @return one record per result row, keyed by column name in column order
     */
    List<Map<String, Object>> execute(String query, Duration lookback);
}
