package com.company.tokenanalytics.domain.plan;

import lombok.Value;

/**
 * Non-null requirement on a derived column.
 */
@Value
public class FilterPredicate {
    String column;

    public static FilterPredicate notNull(String column) {
        return new FilterPredicate(column);
    }
}
