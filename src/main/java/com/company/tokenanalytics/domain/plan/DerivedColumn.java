package com.company.tokenanalytics.domain.plan;

import com.company.tokenanalytics.domain.enums.ColumnOrigin;
import com.company.tokenanalytics.domain.enums.ColumnType;
import lombok.Value;

import java.time.Duration;

/**
 * A typed value extracted from each event before filtering and aggregation.
 */
@Value
public class DerivedColumn {
    String name;
    String sourceField;
    ColumnType type;
    ColumnOrigin origin;
    Duration bucket;  // null unless the value is truncated to a boundary

    public static DerivedColumn payload(String name, String sourceField, ColumnType type) {
        return new DerivedColumn(name, sourceField, type, ColumnOrigin.PAYLOAD, null);
    }

    public static DerivedColumn record(String name, String sourceColumn, ColumnType type) {
        return new DerivedColumn(name, sourceColumn, type, ColumnOrigin.RECORD, null);
    }

    public static DerivedColumn dayBucket(String name, String timestampColumn) {
        return new DerivedColumn(name, timestampColumn, ColumnType.TIMESTAMP, ColumnOrigin.RECORD, Duration.ofDays(1));
    }

    public boolean isBucketed() {
        return bucket != null;
    }
}
