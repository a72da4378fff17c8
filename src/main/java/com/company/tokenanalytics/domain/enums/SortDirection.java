package com.company.tokenanalytics.domain.enums;

public enum SortDirection {
    ASC,
    DESC
}
