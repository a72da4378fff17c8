package com.company.tokenanalytics.domain.enums;

/**
 * Request flags the plan builder overrides instead of rejecting.
 */
public enum Normalization {
    JOB_ID_OPERATION_NORMALIZED_TO_DCOUNT("job_id_operation_normalized_to_dcount"),
    JOB_ANALYSIS_DISABLED_FOR_JOB_ID("job_analysis_disabled_for_job_id");

    private final String code;

    Normalization(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
