package com.company.tokenanalytics.exception;

public class LogAnalyticsNotConfiguredException extends RuntimeException {
    public LogAnalyticsNotConfiguredException() {
        super("LOG_ANALYTICS_WORKSPACE_ID is not configured on the server");
    }
}
