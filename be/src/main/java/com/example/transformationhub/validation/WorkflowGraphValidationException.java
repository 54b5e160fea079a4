package com.example.transformationhub.validation;

import com.example.transformationhub.error.CoreException;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a revision fails structural, connectivity, type or reference validation.
 * <p>
 * Always the caller's fault and never retried. Mapped to HTTP 400 with {@link #getErrors()} in the
 * response body by {@link com.example.transformationhub.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowGraphValidationException extends CoreException {

    private final List<ValidationError> errors;

    public WorkflowGraphValidationException(List<ValidationError> errors) {
        super("Transformation revision validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public WorkflowGraphValidationException(String field, String message) {
        super(message);
        this.errors = List.of(new ValidationError(field, message));
    }
}
