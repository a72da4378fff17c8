package com.company.tokenanalytics.service;

import com.azure.core.http.rest.Response;
import com.azure.core.util.Context;
import com.azure.monitor.query.LogsQueryClient;
import com.azure.monitor.query.models.LogsQueryOptions;
import com.azure.monitor.query.models.LogsQueryResult;
import com.azure.monitor.query.models.LogsQueryResultStatus;
import com.azure.monitor.query.models.QueryTimeInterval;
import com.company.tokenanalytics.config.TokenAnalyticsProperties;
import com.company.tokenanalytics.exception.LogAnalyticsNotConfiguredException;
import com.company.tokenanalytics.exception.LogQueryExecutionException;
import com.company.tokenanalytics.util.LogsTableMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class AzureLogAnalyticsQueryExecutor implements LogQueryExecutor {

    private final LogsQueryClient logsQueryClient;
    private final TokenAnalyticsProperties properties;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    @Override
    public List<Map<String, Object>> execute(String query, Duration lookback) {
        TokenAnalyticsProperties.LogAnalytics settings = properties.getLogAnalytics();
        if (!StringUtils.hasText(settings.getWorkspaceId())) {
            throw new LogAnalyticsNotConfiguredException();
        }

        Span span = tracer.spanBuilder("log_analytics.query")
            .setSpanKind(SpanKind.CLIENT)
            .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("log_analytics.lookback_days", lookback.toDays());

            Response<LogsQueryResult> response = logsQueryClient.queryWorkspaceWithResponse(
                settings.getWorkspaceId(),
                query,
                new QueryTimeInterval(lookback),
                new LogsQueryOptions()
                    .setServerTimeout(settings.getQueryTimeout())
                    .setAllowPartialErrors(true),
                Context.NONE);

            LogsQueryResult result = response.getValue();
            if (LogsQueryResultStatus.PARTIAL_FAILURE.equals(result.getQueryResultStatus())) {
                outcome = "partial";
                log.warn("Log Analytics returned partial results for a {}-day window", lookback.toDays());
            }

            List<Map<String, Object>> rows = LogsTableMapper.toRecords(result.getAllTables());
            span.setAttribute("log_analytics.row_count", rows.size());
            log.debug("Log Analytics query returned {} rows", rows.size());
            return rows;

        } catch (RuntimeException e) {
            outcome = "error";
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Log Analytics query failed");
            log.error("Error executing Log Analytics query", e);
            throw new LogQueryExecutionException("Error querying Log Analytics: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("log_analytics.query.duration", "outcome", outcome));
            span.end();
        }
    }
}
