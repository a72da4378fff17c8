package com.company.tokenanalytics.exception;

public enum ValidationErrorCode {
    METRIC_JOB_ID_REQUIRES_COUNT_OR_DCOUNT(
            "metric_job_id_requires_count_or_dcount",
            "Operation incompatible with job_id metric: only 'count' or 'dcount' are allowed"),
    SUM_INCOMPATIBLE_WITH_JOB_ANALYSIS(
            "sum_incompatible_with_job_analysis",
            "Operation 'sum' is not allowed with analyzeByJob=true: the per-job stage already sums"),
    WINDOW_DAYS_MUST_BE_POSITIVE(
            "window_days_must_be_positive",
            "windowDays must be greater than 0");

    private final String code;
    private final String message;

    ValidationErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
