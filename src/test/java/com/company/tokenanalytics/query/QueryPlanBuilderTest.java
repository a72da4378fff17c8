package com.company.tokenanalytics.query;

import static com.company.tokenanalytics.query.QueryPlanBuilder.DAY;
import static com.company.tokenanalytics.query.QueryPlanBuilder.EXECUTING_USER;
import static com.company.tokenanalytics.query.QueryPlanBuilder.JOB_ID;
import static com.company.tokenanalytics.query.QueryPlanBuilder.JOB_TOTAL;
import static com.company.tokenanalytics.query.QueryPlanBuilder.MODEL_NAME;
import static com.company.tokenanalytics.query.QueryPlanBuilder.PROJECT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.company.tokenanalytics.config.TokenAnalyticsProperties;
import com.company.tokenanalytics.domain.QueryRequest;
import com.company.tokenanalytics.domain.enums.AggregationOperation;
import com.company.tokenanalytics.domain.enums.AnalysisMode;
import com.company.tokenanalytics.domain.enums.ColumnType;
import com.company.tokenanalytics.domain.enums.Normalization;
import com.company.tokenanalytics.domain.enums.SortDirection;
import com.company.tokenanalytics.domain.enums.TokenMetric;
import com.company.tokenanalytics.domain.plan.AggregationStage;
import com.company.tokenanalytics.domain.plan.DerivedColumn;
import com.company.tokenanalytics.domain.plan.FilterPredicate;
import com.company.tokenanalytics.domain.plan.OrderSpec;
import com.company.tokenanalytics.domain.plan.QueryPlan;
import com.company.tokenanalytics.exception.QueryValidationException;
import com.company.tokenanalytics.exception.ValidationErrorCode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class QueryPlanBuilderTest {

    private final QueryPlanBuilder builder = new QueryPlanBuilder(new TokenAnalyticsProperties.EventSchema());

    @Test
    void defaultRequestBuildsSingleStageAverage() {
        QueryPlan plan = builder.build(QueryRequest.builder().build());

        assertThat(plan.getAnalysisMode()).isEqualTo(AnalysisMode.EVENT_LEVEL);
        assertThat(plan.getGroupKeys()).containsExactly(PROJECT, EXECUTING_USER);
        assertThat(plan.getOutputColumnName()).isEqualTo("Avg_tokens_in");
        assertThat(plan.getStages()).containsExactly(new AggregationStage(
                "tokens_in", AggregationOperation.AVG, "Avg_tokens_in", List.of(PROJECT, EXECUTING_USER)));
        assertThat(plan.getOrder()).containsExactly(OrderSpec.asc(PROJECT), OrderSpec.desc("Avg_tokens_in"));
        assertThat(plan.getFilters()).extracting(FilterPredicate::getColumn).containsExactly(PROJECT, "tokens_in");
        assertThat(plan.getNormalizations()).isEmpty();
    }

    @Test
    void tokenMetricsReadConfiguredPayloadFields() {
        TokenAnalyticsProperties.EventSchema schema = new TokenAnalyticsProperties.EventSchema();
        schema.setTokensOutField("completion_tokens");
        QueryPlan plan = new QueryPlanBuilder(schema).build(QueryRequest.builder()
                .metric(TokenMetric.TOKENS_OUT)
                .operation(AggregationOperation.MAX)
                .build());

        assertThat(plan.getDerivedColumns())
                .contains(DerivedColumn.payload("tokens_out", "completion_tokens", ColumnType.NUMBER));
        assertThat(plan.getOutputColumnName()).isEqualTo("Max_tokens_out");
    }

    @Test
    void jobIdMetricCountsDistinctJobs() {
        QueryPlan plan = builder.build(QueryRequest.builder()
                .metric(TokenMetric.JOB_ID)
                .operation(AggregationOperation.COUNT)
                .build());

        assertThat(plan.getOutputColumnName()).isEqualTo("UniqueJobCount");
        assertThat(plan.getStages()).hasSize(1);
        assertThat(plan.getFinalStage().getFunction()).isEqualTo(AggregationOperation.DCOUNT);
        assertThat(plan.getFinalStage().getInputColumn()).isEqualTo(JOB_ID);
        assertThat(plan.isFiltered(JOB_ID)).isTrue();
        assertThat(plan.getEffectiveRequest().getOperation()).isEqualTo(AggregationOperation.DCOUNT);
        assertThat(plan.getNormalizations()).containsExactly(Normalization.JOB_ID_OPERATION_NORMALIZED_TO_DCOUNT);
    }

    @Test
    void jobIdMetricWithDcountNeedsNoNormalization() {
        QueryPlan plan = builder.build(QueryRequest.builder()
                .metric(TokenMetric.JOB_ID)
                .operation(AggregationOperation.DCOUNT)
                .build());

        assertThat(plan.getNormalizations()).isEmpty();
        assertThat(plan.getOutputColumnName()).isEqualTo("UniqueJobCount");
    }

    @Test
    void jobIdMetricSilentlyDisablesJobAnalysis() {
        QueryPlan plan = builder.build(QueryRequest.builder()
                .metric(TokenMetric.JOB_ID)
                .operation(AggregationOperation.DCOUNT)
                .analyzeByJob(true)
                .build());

        assertThat(plan.getAnalysisMode()).isEqualTo(AnalysisMode.EVENT_LEVEL);
        assertThat(plan.getStages()).hasSize(1);
        assertThat(plan.getEffectiveRequest().isAnalyzeByJob()).isFalse();
        assertThat(plan.getNormalizations()).containsExactly(Normalization.JOB_ANALYSIS_DISABLED_FOR_JOB_ID);
        assertThat(plan.getDerivedColumns()).filteredOn(column -> column.getName().equals(JOB_ID)).hasSize(1);
    }

    @Test
    void jobIdMetricRejectsNonCountingOperations() {
        for (AggregationOperation operation : List.of(AggregationOperation.AVG, AggregationOperation.SUM,
                AggregationOperation.MIN, AggregationOperation.MAX)) {
            assertThatThrownBy(() -> builder.build(QueryRequest.builder()
                    .metric(TokenMetric.JOB_ID)
                    .operation(operation)
                    .analyzeByJob(true)
                    .build()))
                    .isInstanceOf(QueryValidationException.class)
                    .extracting(ex -> ((QueryValidationException) ex).getErrorCode())
                    .isEqualTo(ValidationErrorCode.METRIC_JOB_ID_REQUIRES_COUNT_OR_DCOUNT);
        }
    }

    @Test
    void jobAnalysisBuildsPerJobSumThenOperation() {
        QueryPlan plan = builder.build(QueryRequest.builder()
                .metric(TokenMetric.TOKENS_OUT)
                .operation(AggregationOperation.AVG)
                .analyzeByJob(true)
                .build());

        assertThat(plan.getAnalysisMode()).isEqualTo(AnalysisMode.JOB_LEVEL);
        assertThat(plan.getStages()).containsExactly(
                new AggregationStage("tokens_out", AggregationOperation.SUM, JOB_TOTAL,
                        List.of(PROJECT, EXECUTING_USER, JOB_ID)),
                new AggregationStage(JOB_TOTAL, AggregationOperation.AVG, "Avg_tokens_out",
                        List.of(PROJECT, EXECUTING_USER)));
        assertThat(plan.isFiltered(JOB_ID)).isTrue();
        assertThat(plan.isFiltered("tokens_out")).isTrue();
    }

    @Test
    void sumIsRejectedWithJobAnalysis() {
        assertThatThrownBy(() -> builder.build(QueryRequest.builder()
                .metric(TokenMetric.TOKENS_OUT)
                .operation(AggregationOperation.SUM)
                .analyzeByJob(true)
                .build()))
                .isInstanceOf(QueryValidationException.class)
                .hasMessageContaining("sum")
                .extracting(ex -> ((QueryValidationException) ex).getErrorCode())
                .isEqualTo(ValidationErrorCode.SUM_INCOMPATIBLE_WITH_JOB_ANALYSIS);
    }

    @Test
    void sumIsAllowedPerEvent() {
        QueryPlan plan = builder.build(QueryRequest.builder().operation(AggregationOperation.SUM).build());

        assertThat(plan.getOutputColumnName()).isEqualTo("Sum_tokens_in");
        assertThat(plan.getStages()).hasSize(1);
    }

    @Test
    void nonPositiveWindowIsRejected() {
        assertThatThrownBy(() -> builder.build(QueryRequest.builder().windowDays(0).build()))
                .isInstanceOf(QueryValidationException.class)
                .extracting(ex -> ((QueryValidationException) ex).getErrorCode())
                .isEqualTo(ValidationErrorCode.WINDOW_DAYS_MUST_BE_POSITIVE);
    }

    @Test
    void dailyBucketsAreGroupedFilteredAndOrderedAfterProject() {
        QueryPlan plan = builder.build(QueryRequest.builder()
                .daily(true)
                .groupByModel(true)
                .build());

        assertThat(plan.getGroupKeys()).containsExactly(PROJECT, EXECUTING_USER, MODEL_NAME, DAY);
        assertThat(plan.getOrder()).containsExactly(
                OrderSpec.asc(PROJECT), OrderSpec.asc(DAY), OrderSpec.desc("Avg_tokens_in"));
        assertThat(plan.isFiltered(QueryPlanBuilder.EVENT_TIME)).isTrue();
        assertThat(plan.getDerivedColumns())
                .filteredOn(column -> column.getName().equals(DAY))
                .singleElement()
                .satisfies(column -> assertThat(column.isBucketed()).isTrue());
    }

    @Test
    void invariantsHoldForEveryFlagCombination() {
        for (QueryRequest request : allRequests()) {
            QueryPlan plan;
            try {
                plan = builder.build(request);
            } catch (QueryValidationException e) {
                assertRejectionIsExpected(request, e.getErrorCode());
                continue;
            }

            // executing user is always grouped and never filtered
            assertThat(plan.getGroupKeys()).contains(EXECUTING_USER);
            assertThat(plan.isFiltered(EXECUTING_USER)).isFalse();

            assertThat(plan.getGroupKeys().contains(MODEL_NAME)).isEqualTo(request.isGroupByModel());
            assertThat(plan.isFiltered(MODEL_NAME)).isEqualTo(request.isGroupByModel());
            assertThat(plan.hasDerivedColumn(MODEL_NAME)).isEqualTo(request.isGroupByModel());

            List<OrderSpec> order = plan.getOrder();
            assertThat(order.get(0)).isEqualTo(OrderSpec.asc(PROJECT));
            assertThat(order.get(order.size() - 1))
                    .isEqualTo(new OrderSpec(plan.getOutputColumnName(), SortDirection.DESC));
            if (request.isDaily()) {
                assertThat(order.get(1)).isEqualTo(OrderSpec.asc(DAY));
            }

            if (request.getMetric() == TokenMetric.JOB_ID) {
                assertThat(plan.getStages()).hasSize(1);
                assertThat(plan.getFinalStage().getFunction()).isEqualTo(AggregationOperation.DCOUNT);
                assertThat(plan.getOutputColumnName()).isEqualTo(QueryPlanBuilder.UNIQUE_JOB_COUNT);
            } else if (request.isAnalyzeByJob()) {
                assertThat(plan.getStages()).hasSize(2);
                AggregationStage perJob = plan.getStages().get(0);
                AggregationStage overJobs = plan.getStages().get(1);
                assertThat(perJob.getFunction()).isEqualTo(AggregationOperation.SUM);
                List<String> expectedKeys = new ArrayList<>(overJobs.getGroupBy());
                expectedKeys.add(JOB_ID);
                assertThat(perJob.getGroupBy()).isEqualTo(expectedKeys);
            } else {
                assertThat(plan.getStages()).hasSize(1);
            }
            assertThat(plan.getStages()).hasSize(plan.getAnalysisMode().getStageCount());

            assertReferencedColumnsAreDerived(plan);
        }
    }

    @Test
    void buildingTwiceYieldsEqualPlans() {
        QueryRequest request = QueryRequest.builder()
                .metric(TokenMetric.TOKENS_IN)
                .operation(AggregationOperation.MIN)
                .groupByModel(true)
                .analyzeByJob(true)
                .daily(true)
                .build();

        assertThat(builder.build(request)).isEqualTo(builder.build(request));
    }

    private void assertRejectionIsExpected(QueryRequest request, ValidationErrorCode code) {
        if (request.getMetric() == TokenMetric.JOB_ID) {
            assertThat(request.getOperation().isCounting()).isFalse();
            assertThat(code).isEqualTo(ValidationErrorCode.METRIC_JOB_ID_REQUIRES_COUNT_OR_DCOUNT);
        } else {
            assertThat(request.isAnalyzeByJob()).isTrue();
            assertThat(request.getOperation()).isEqualTo(AggregationOperation.SUM);
            assertThat(code).isEqualTo(ValidationErrorCode.SUM_INCOMPATIBLE_WITH_JOB_ANALYSIS);
        }
    }

    private void assertReferencedColumnsAreDerived(QueryPlan plan) {
        Set<String> derived = plan.getDerivedColumns().stream()
                .map(DerivedColumn::getName)
                .collect(Collectors.toSet());
        Set<String> referenced = new HashSet<>(plan.getGroupKeys());
        plan.getFilters().forEach(filter -> referenced.add(filter.getColumn()));
        for (AggregationStage stage : plan.getStages()) {
            referenced.addAll(stage.getGroupBy());
            if (!stage.getInputColumn().equals(JOB_TOTAL)) {
                referenced.add(stage.getInputColumn());
            }
        }
        assertThat(derived).containsAll(referenced);
    }

    private List<QueryRequest> allRequests() {
        List<QueryRequest> requests = new ArrayList<>();
        for (TokenMetric metric : TokenMetric.values()) {
            for (AggregationOperation operation : AggregationOperation.values()) {
                for (int flags = 0; flags < 8; flags++) {
                    requests.add(QueryRequest.builder()
                            .windowDays(7)
                            .metric(metric)
                            .operation(operation)
                            .groupByModel((flags & 1) != 0)
                            .analyzeByJob((flags & 2) != 0)
                            .daily((flags & 4) != 0)
                            .build());
                }
            }
        }
        return requests;
    }
}
