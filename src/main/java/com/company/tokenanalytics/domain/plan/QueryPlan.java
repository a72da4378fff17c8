package com.company.tokenanalytics.domain.plan;

import com.company.tokenanalytics.domain.QueryRequest;
import com.company.tokenanalytics.domain.enums.AnalysisMode;
import com.company.tokenanalytics.domain.enums.Normalization;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Renderer-ready description of one analytics query.
 *
 * <p>{@code analysisMode} tags the shape: {@link AnalysisMode#EVENT_LEVEL} plans carry one
 * stage, {@link AnalysisMode#JOB_LEVEL} plans carry a per-job {@code sum} stage followed by
 * the requested operation over the job totals.
 *
 * <p>{@code effectiveRequest} is the caller's request after normalization; each override
 * applied to get there is listed in {@code normalizations}.
 */
@Value
@Builder(builderClassName = "PlanBuilder")
public class QueryPlan {
    @Singular
    List<DerivedColumn> derivedColumns;

    @Singular
    List<FilterPredicate> filters;

    @Singular
    List<String> groupKeys;

    @Singular
    List<AggregationStage> stages;

    @Singular("orderBy")
    List<OrderSpec> order;

    String outputColumnName;
    AnalysisMode analysisMode;
    QueryRequest effectiveRequest;

    @Singular
    Set<Normalization> normalizations;

    public AggregationStage getFinalStage() {
        return stages.get(stages.size() - 1);
    }

    public boolean hasDerivedColumn(String name) {
        return derivedColumns.stream().anyMatch(column -> column.getName().equals(name));
    }

    public boolean isFiltered(String column) {
        return filters.stream().anyMatch(filter -> filter.getColumn().equals(column));
    }
}
