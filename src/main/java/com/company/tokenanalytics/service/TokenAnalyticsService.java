package com.company.tokenanalytics.service;

import com.company.tokenanalytics.domain.QueryRequest;
import com.company.tokenanalytics.domain.plan.QueryPlan;
import com.company.tokenanalytics.dto.response.TokenStatsResult;
import com.company.tokenanalytics.query.KqlPlanRenderer;
import com.company.tokenanalytics.query.QueryPlanBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class TokenAnalyticsService {

    private final QueryPlanBuilder planBuilder;
    private final KqlPlanRenderer renderer;
    private final LogQueryExecutor queryExecutor;

    public TokenStatsResult getTokenStats(QueryRequest request) {
        QueryPlan plan = planBuilder.build(request);

        if (!plan.getNormalizations().isEmpty()) {
            log.info("Request flags normalized: {} (effective operation={}, analyzeByJob={})",
                    plan.getNormalizations(),
                    plan.getEffectiveRequest().getOperation().getWireName(),
                    plan.getEffectiveRequest().isAnalyzeByJob());
        }

        String query = renderer.render(plan);
        log.debug("Running {} query over {} days:\n{}", plan.getAnalysisMode(), request.getWindowDays(), query);

        List<Map<String, Object>> rows = queryExecutor.execute(query, Duration.ofDays(request.getWindowDays()));

        return TokenStatsResult.builder()
                .rows(rows)
                .normalizations(plan.getNormalizations())
                .build();
    }
}
