package com.company.tokenanalytics.domain.plan;

import com.company.tokenanalytics.domain.enums.AggregationOperation;
import lombok.Value;

import java.util.List;

@Value
public class AggregationStage {
    String inputColumn;
    AggregationOperation function;
    String outputColumn;
    List<String> groupBy;

    public AggregationStage(String inputColumn, AggregationOperation function,
                            String outputColumn, List<String> groupBy) {
        this.inputColumn = inputColumn;
        this.function = function;
        this.outputColumn = outputColumn;
        this.groupBy = List.copyOf(groupBy);
    }
}
