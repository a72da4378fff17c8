package com.company.tokenanalytics.query;

import com.company.tokenanalytics.config.TokenAnalyticsProperties.EventSchema;
import com.company.tokenanalytics.domain.enums.AggregationOperation;
import com.company.tokenanalytics.domain.enums.ColumnOrigin;
import com.company.tokenanalytics.domain.enums.ColumnType;
import com.company.tokenanalytics.domain.plan.AggregationStage;
import com.company.tokenanalytics.domain.plan.DerivedColumn;
import com.company.tokenanalytics.domain.plan.FilterPredicate;
import com.company.tokenanalytics.domain.plan.OrderSpec;
import com.company.tokenanalytics.domain.plan.QueryPlan;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Serializes a {@link QueryPlan} into KQL. Same plan, same text.
 */
@RequiredArgsConstructor
public class KqlPlanRenderer {

    static final String PAYLOAD_ALIAS = "msg_data";
    private static final String INDENT = "    ";

    private final EventSchema schema;

    public String render(QueryPlan plan) {
        List<String> lines = new ArrayList<>();
        lines.add(schema.getEventTable());
        lines.add("| extend " + PAYLOAD_ALIAS + " = parse_json(" + schema.getPayloadColumn() + ")");
        lines.add("| extend");
        lines.add(plan.getDerivedColumns().stream()
                .map(column -> INDENT + identifier(column.getName()) + " = " + expression(column))
                .collect(Collectors.joining(",\n")));
        lines.add("| where " + renderFilters(plan));

        for (AggregationStage stage : plan.getStages()) {
            lines.add("| summarize " + identifier(stage.getOutputColumn()) + " = " + aggregate(stage)
                    + " by " + stage.getGroupBy().stream()
                    .map(KqlPlanRenderer::identifier)
                    .collect(Collectors.joining(", ")));
        }

        lines.add("| order by " + plan.getOrder().stream()
                .map(this::orderTerm)
                .collect(Collectors.joining(", ")));
        return String.join("\n", lines);
    }

    private String renderFilters(QueryPlan plan) {
        Map<String, ColumnType> types = plan.getDerivedColumns().stream()
                .collect(Collectors.toMap(DerivedColumn::getName, DerivedColumn::getType, (a, b) -> a));

        return plan.getFilters().stream()
                .map(FilterPredicate::getColumn)
                .map(column -> notNullTest(column, types.get(column)))
                .collect(Collectors.joining(" and "));
    }

    private String expression(DerivedColumn column) {
        String source = column.getOrigin() == ColumnOrigin.PAYLOAD
                ? PAYLOAD_ALIAS + "." + column.getSourceField()
                : column.getSourceField();
        String typed = cast(column.getType()) + "(" + source + ")";
        return column.isBucketed() ? "bin(" + typed + ", " + timespan(column.getBucket()) + ")" : typed;
    }

    private static String cast(ColumnType type) {
        switch (type) {
            case NUMBER:
                return "todouble";
            case TIMESTAMP:
                return "todatetime";
            default:
                return "tostring";
        }
    }

    // tostring() of a missing payload field yields "", never null
    private String notNullTest(String column, ColumnType type) {
        return (type == ColumnType.STRING ? "isnotempty(" : "isnotnull(") + identifier(column) + ")";
    }

    private String aggregate(AggregationStage stage) {
        if (stage.getFunction() == AggregationOperation.COUNT) {
            return "count()";
        }
        return stage.getFunction().getWireName() + "(" + identifier(stage.getInputColumn()) + ")";
    }

    private String orderTerm(OrderSpec order) {
        return identifier(order.getColumn()) + " " + order.getDirection().name().toLowerCase(Locale.ROOT);
    }

    // Plan columns such as "project" collide with KQL operator names
    static String identifier(String name) {
        return "['" + name + "']";
    }

    private static String timespan(Duration duration) {
        if (duration.toDays() > 0 && duration.toHours() % 24 == 0) {
            return duration.toDays() + "d";
        }
        if (duration.toHours() > 0 && duration.toMinutes() % 60 == 0) {
            return duration.toHours() + "h";
        }
        return duration.toMinutes() + "m";
    }
}
