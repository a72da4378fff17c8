package com.company.tokenanalytics.exception;

public class LogQueryExecutionException extends RuntimeException {
    public LogQueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
