package com.company.tokenanalytics.domain.enums;

/**
 * Where a derived column reads its value from.
 */
public enum ColumnOrigin {
    PAYLOAD,  // field of the JSON payload carried in each log record
    RECORD    // native column of the log table
}
