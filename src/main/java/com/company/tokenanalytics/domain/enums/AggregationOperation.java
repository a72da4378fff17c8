package com.company.tokenanalytics.domain.enums;

import com.company.tokenanalytics.exception.InvalidRequestParameterException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Aggregation functions a caller may request. The wire name doubles as the KQL function name.
 */
public enum AggregationOperation {
    AVG("avg"),
    SUM("sum"),
    COUNT("count"),
    MIN("min"),
    MAX("max"),
    DCOUNT("dcount");

    private final String wireName;

    AggregationOperation(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isCounting() {
        return this == COUNT || this == DCOUNT;
    }

    /**
     * Prefix used for the output column, e.g. {@code Avg} in {@code Avg_tokens_in}.
     */
    public String getDisplayName() {
        return Character.toUpperCase(wireName.charAt(0)) + wireName.substring(1);
    }

    public static AggregationOperation fromWireName(String value) {
        if (value == null) {
            return AVG;
        }
        for (AggregationOperation operation : values()) {
            if (operation.wireName.equalsIgnoreCase(value.trim())) {
                return operation;
            }
        }
        throw new InvalidRequestParameterException("operation", value, allowedValues());
    }

    public static String allowedValues() {
        return Arrays.stream(values())
                .map(AggregationOperation::getWireName)
                .collect(Collectors.joining(", "));
    }
}
