package com.company.tokenanalytics.domain.enums;

public enum ColumnType {
    STRING,
    NUMBER,
    TIMESTAMP
}
