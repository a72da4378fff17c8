package com.company.tokenanalytics.util;

import com.azure.monitor.query.models.LogsColumnType;
import com.azure.monitor.query.models.LogsTable;
import com.azure.monitor.query.models.LogsTableCell;
import com.azure.monitor.query.models.LogsTableRow;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts Log Analytics result tables into JSON-friendly records.
 */
public class LogsTableMapper {

    private LogsTableMapper() {
    }

    /**
     * Only the primary (first) table is mapped; an empty result maps to an empty list.
     */
    public static List<Map<String, Object>> toRecords(List<LogsTable> tables) {
        if (tables == null || tables.isEmpty()) {
            return Collections.emptyList();
        }

        List<Map<String, Object>> records = new ArrayList<>();
        for (LogsTableRow row : tables.get(0).getRows()) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (LogsTableCell cell : row.getRow()) {
                record.put(cell.getColumnName(), convert(cell.getColumnType(), cell.getValueAsString()));
            }
            records.add(record);
        }
        return records;
    }

    public static Object convert(LogsColumnType type, String raw) {
        if (raw == null) return null;

        if (LogsColumnType.LONG.equals(type) || LogsColumnType.INT.equals(type)) {
            return Long.parseLong(raw);
        }
        if (LogsColumnType.REAL.equals(type) || LogsColumnType.DECIMAL.equals(type)) {
            return Double.parseDouble(raw);
        }
        if (LogsColumnType.BOOL.equals(type)) {
            return Boolean.parseBoolean(raw);
        }
        if (LogsColumnType.DATETIME.equals(type)) {
            return OffsetDateTime.parse(raw);
        }
        return raw;
    }
}
