package com.company.tokenanalytics.domain.plan;

import com.company.tokenanalytics.domain.enums.SortDirection;
import lombok.Value;

@Value
public class OrderSpec {
    String column;
    SortDirection direction;

    public static OrderSpec asc(String column) {
        return new OrderSpec(column, SortDirection.ASC);
    }

    public static OrderSpec desc(String column) {
        return new OrderSpec(column, SortDirection.DESC);
    }
}
