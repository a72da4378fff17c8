package com.company.tokenanalytics.exception;

public class InvalidRequestParameterException extends RuntimeException {
    public InvalidRequestParameterException(String parameter, String value, String allowedValues) {
        super("Invalid value '" + value + "' for parameter '" + parameter + "'. Allowed: " + allowedValues);
    }
}
