package com.company.tokenanalytics.exception;

/**
 * Request flags that cannot be combined into a query. Never retryable.
 */
public class QueryValidationException extends RuntimeException {

    private final ValidationErrorCode errorCode;

    public QueryValidationException(ValidationErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public ValidationErrorCode getErrorCode() {
        return errorCode;
    }
}
