package com.company.tokenanalytics.controller;

import com.company.tokenanalytics.domain.QueryRequest;
import com.company.tokenanalytics.domain.enums.AggregationOperation;
import com.company.tokenanalytics.domain.enums.Normalization;
import com.company.tokenanalytics.domain.enums.TokenMetric;
import com.company.tokenanalytics.dto.response.TokenStatsResult;
import com.company.tokenanalytics.security.CallerContext;
import com.company.tokenanalytics.service.TokenAnalyticsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Token Analytics", description = "Aggregated token usage per project and user")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class TokenStatsController {

    static final String NORMALIZATIONS_HEADER = "X-Query-Normalizations";

    private final TokenAnalyticsService analyticsService;
    private final CallerContext callerContext;
    private final MeterRegistry meterRegistry;

    /**
     * Aggregated token statistics over the last {@code windowDays} days.
     * With analyzeByJob=false the operation applies per event, e.g. avg(event);
     * with analyzeByJob=true it applies to per-job totals, e.g. avg(sum(job)).
     */
    @GetMapping("/token-stats")
    @Operation(
            summary = "Aggregate token usage",
            description = "Groups by project and executing user, optionally by model and day. "
                    + "metric=job_id counts distinct jobs and ignores analyzeByJob."
    )
    @PreAuthorize("hasAnyRole('UI_READER', 'ANALYTICS_READER')")
    public ResponseEntity<List<Map<String, Object>>> getTokenStats(
            @Parameter(description = "Analysis period in days")
            @RequestParam(defaultValue = "30") @Min(1) int windowDays,
            @Parameter(description = "tokens_in, tokens_out or job_id")
            @RequestParam(defaultValue = "tokens_in") String metric,
            @Parameter(description = "avg, sum, count, min, max or dcount")
            @RequestParam(defaultValue = "avg") String operation,
            @Parameter(description = "Also group by model name")
            @RequestParam(defaultValue = "false") boolean groupByModel,
            @Parameter(description = "Aggregate per-job totals instead of individual events")
            @RequestParam(defaultValue = "false") boolean analyzeByJob,
            @Parameter(description = "Also group by day")
            @RequestParam(defaultValue = "false") boolean daily) {

        QueryRequest request = QueryRequest.builder()
                .windowDays(windowDays)
                .metric(TokenMetric.fromWireName(metric))
                .operation(AggregationOperation.fromWireName(operation))
                .groupByModel(groupByModel)
                .analyzeByJob(analyzeByJob)
                .daily(daily)
                .build();

        log.info("Token stats request from user {}: {}", callerContext.getCurrentUserId(), request);

        meterRegistry.counter("api.analytics.token_stats.requests",
                "metric", request.getMetric().getWireName(),
                "operation", request.getOperation().getWireName()
        ).increment();

        TokenStatsResult result = analyticsService.getTokenStats(request);

        ResponseEntity.BodyBuilder response = ResponseEntity.ok();
        if (!result.getNormalizations().isEmpty()) {
            response.header(NORMALIZATIONS_HEADER, result.getNormalizations().stream()
                    .map(Normalization::getCode)
                    .collect(Collectors.joining(",")));
        }
        return response.body(result.getRows());
    }
}
