package com.company.tokenanalytics.query;

import com.company.tokenanalytics.config.TokenAnalyticsProperties.EventSchema;
import com.company.tokenanalytics.domain.QueryRequest;
import com.company.tokenanalytics.domain.enums.AggregationOperation;
import com.company.tokenanalytics.domain.enums.AnalysisMode;
import com.company.tokenanalytics.domain.enums.ColumnType;
import com.company.tokenanalytics.domain.enums.Normalization;
import com.company.tokenanalytics.domain.enums.TokenMetric;
import com.company.tokenanalytics.domain.plan.AggregationStage;
import com.company.tokenanalytics.domain.plan.DerivedColumn;
import com.company.tokenanalytics.domain.plan.FilterPredicate;
import com.company.tokenanalytics.domain.plan.OrderSpec;
import com.company.tokenanalytics.domain.plan.QueryPlan;
import com.company.tokenanalytics.exception.QueryValidationException;
import com.company.tokenanalytics.exception.ValidationErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link QueryRequest} into a {@link QueryPlan}, or rejects flag combinations
 * that have no meaningful query.
 *
 * <p>Stateless: one instance serves all requests concurrently.
 */
@Slf4j
@RequiredArgsConstructor
public class QueryPlanBuilder {

    public static final String PROJECT = "project";
    public static final String EXECUTING_USER = "executing_user";
    public static final String MODEL_NAME = "model_name";
    public static final String JOB_ID = "job_id";
    public static final String EVENT_TIME = "event_time";
    public static final String DAY = "day";
    public static final String JOB_TOTAL = "job_token_total";
    public static final String UNIQUE_JOB_COUNT = "UniqueJobCount";

    private final EventSchema schema;

    public QueryPlan build(QueryRequest request) {
        if (request.getWindowDays() <= 0) {
            throw new QueryValidationException(ValidationErrorCode.WINDOW_DAYS_MUST_BE_POSITIVE);
        }

        QueryPlan.PlanBuilder plan = QueryPlan.builder();
        List<String> groupKeys = new ArrayList<>();

        plan.derivedColumn(DerivedColumn.payload(PROJECT, schema.getProjectField(), ColumnType.STRING))
                .filter(FilterPredicate.notNull(PROJECT))
                .orderBy(OrderSpec.asc(PROJECT));
        groupKeys.add(PROJECT);

        // Grouped but never filtered: automated runs log events without a user.
        plan.derivedColumn(DerivedColumn.payload(EXECUTING_USER, schema.getExecutingUserField(), ColumnType.STRING));
        groupKeys.add(EXECUTING_USER);

        if (request.isGroupByModel()) {
            plan.derivedColumn(DerivedColumn.payload(MODEL_NAME, schema.getModelField(), ColumnType.STRING))
                    .filter(FilterPredicate.notNull(MODEL_NAME));
            groupKeys.add(MODEL_NAME);
        }

        if (request.isDaily()) {
            plan.derivedColumn(DerivedColumn.record(EVENT_TIME, schema.getTimestampColumn(), ColumnType.TIMESTAMP))
                    .derivedColumn(DerivedColumn.dayBucket(DAY, schema.getTimestampColumn()))
                    .filter(FilterPredicate.notNull(EVENT_TIME))
                    .orderBy(OrderSpec.asc(DAY));
            groupKeys.add(DAY);
        }

        QueryRequest effective = resolveMetric(request, plan);
        String metricColumn = effective.getMetric().getWireName();
        String outputColumn = outputColumnName(effective);

        if (effective.isAnalyzeByJob()) {
            if (effective.getOperation() == AggregationOperation.SUM) {
                throw new QueryValidationException(ValidationErrorCode.SUM_INCOMPATIBLE_WITH_JOB_ANALYSIS);
            }
            plan.derivedColumn(jobIdColumn())
                    .filter(FilterPredicate.notNull(JOB_ID));

            List<String> perJobKeys = new ArrayList<>(groupKeys);
            perJobKeys.add(JOB_ID);
            plan.analysisMode(AnalysisMode.JOB_LEVEL)
                    .stage(new AggregationStage(metricColumn, AggregationOperation.SUM, JOB_TOTAL, perJobKeys))
                    .stage(new AggregationStage(JOB_TOTAL, effective.getOperation(), outputColumn, groupKeys));
        } else {
            plan.analysisMode(AnalysisMode.EVENT_LEVEL)
                    .stage(new AggregationStage(metricColumn, effective.getOperation(), outputColumn, groupKeys));
        }

        return plan.groupKeys(groupKeys)
                .orderBy(OrderSpec.desc(outputColumn))
                .outputColumnName(outputColumn)
                .effectiveRequest(effective)
                .build();
    }

    /**
     * Derives and filters the metric column. A {@code job_id} metric is a distinct count of
     * jobs: its operation is normalized to {@code dcount} and job-level analysis is switched off.
     *
     * @return the request with overridden flags applied
     */
    private QueryRequest resolveMetric(QueryRequest request, QueryPlan.PlanBuilder plan) {
        if (request.getMetric().isTokenCount()) {
            String column = request.getMetric().getWireName();
            plan.derivedColumn(DerivedColumn.payload(column, tokenField(request.getMetric()), ColumnType.NUMBER))
                    .filter(FilterPredicate.notNull(column));
            return request;
        }

        if (!request.getOperation().isCounting()) {
            throw new QueryValidationException(ValidationErrorCode.METRIC_JOB_ID_REQUIRES_COUNT_OR_DCOUNT);
        }
        plan.derivedColumn(jobIdColumn())
                .filter(FilterPredicate.notNull(JOB_ID));

        QueryRequest effective = request;
        if (request.getOperation() != AggregationOperation.DCOUNT) {
            plan.normalization(Normalization.JOB_ID_OPERATION_NORMALIZED_TO_DCOUNT);
            effective = effective.withOperation(AggregationOperation.DCOUNT);
        }
        if (request.isAnalyzeByJob()) {
            log.debug("Ignoring analyzeByJob for job_id metric");
            plan.normalization(Normalization.JOB_ANALYSIS_DISABLED_FOR_JOB_ID);
            effective = effective.withAnalyzeByJob(false);
        }
        return effective;
    }

    private String outputColumnName(QueryRequest effective) {
        if (effective.getMetric() == TokenMetric.JOB_ID) {
            return UNIQUE_JOB_COUNT;
        }
        return effective.getOperation().getDisplayName() + "_" + effective.getMetric().getWireName();
    }

    private String tokenField(TokenMetric metric) {
        return metric == TokenMetric.TOKENS_OUT ? schema.getTokensOutField() : schema.getTokensInField();
    }

    private DerivedColumn jobIdColumn() {
        return DerivedColumn.payload(JOB_ID, schema.getJobIdField(), ColumnType.STRING);
    }
}
