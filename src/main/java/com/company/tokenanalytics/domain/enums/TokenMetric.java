package com.company.tokenanalytics.domain.enums;

import com.company.tokenanalytics.exception.InvalidRequestParameterException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum TokenMetric {
    TOKENS_IN("tokens_in", "Input tokens consumed per event"),
    TOKENS_OUT("tokens_out", "Output tokens produced per event"),
    JOB_ID("job_id", "Job identifier, counted for uniqueness");

    private final String wireName;
    private final String description;

    TokenMetric(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTokenCount() {
        return this != JOB_ID;
    }

    public static TokenMetric fromWireName(String value) {
        if (value == null) {
            return TOKENS_IN;
        }
        for (TokenMetric metric : values()) {
            if (metric.wireName.equalsIgnoreCase(value.trim())) {
                return metric;
            }
        }
        throw new InvalidRequestParameterException("metric", value, allowedValues());
    }

    public static String allowedValues() {
        return Arrays.stream(values())
                .map(TokenMetric::getWireName)
                .collect(Collectors.joining(", "));
    }
}
