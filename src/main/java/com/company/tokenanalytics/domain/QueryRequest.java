package com.company.tokenanalytics.domain;

import com.company.tokenanalytics.domain.enums.AggregationOperation;
import com.company.tokenanalytics.domain.enums.TokenMetric;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Analytics request after primitive parameter parsing.
 */
@Value
@Builder
@With
public class QueryRequest {
    public static final int DEFAULT_WINDOW_DAYS = 30;

    @Builder.Default
    int windowDays = DEFAULT_WINDOW_DAYS;

    @Builder.Default
    TokenMetric metric = TokenMetric.TOKENS_IN;

    @Builder.Default
    AggregationOperation operation = AggregationOperation.AVG;

    boolean groupByModel;
    boolean analyzeByJob;
    boolean daily;
}
