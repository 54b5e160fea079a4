package com.example.transformationhub.api;

import com.example.transformationhub.validation.ValidationError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Standard error response body (4xx/5xx): message, optional field errors, and whether the
 * request may be retried as is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<ValidationError> errors, Boolean retryable) {

    public ErrorResponse(String message) {
        this(message, null, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null, null);
    }

    public static ErrorResponse retryable(String message) {
        return new ErrorResponse(message, null, Boolean.TRUE);
    }
}
