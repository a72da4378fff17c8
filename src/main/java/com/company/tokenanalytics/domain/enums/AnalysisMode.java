package com.company.tokenanalytics.domain.enums;

public enum AnalysisMode {
    EVENT_LEVEL(1),  // aggregate events directly
    JOB_LEVEL(2);    // sum per job first, then aggregate the job totals

    private final int stageCount;

    AnalysisMode(int stageCount) {
        this.stageCount = stageCount;
    }

    public int getStageCount() {
        return stageCount;
    }
}
