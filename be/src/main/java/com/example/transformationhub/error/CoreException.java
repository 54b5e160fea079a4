package com.example.transformationhub.error;

/**
 * Base of every typed failure raised by validation, nesting, lifecycle and code generation.
 * <p>
 * Mapped to HTTP responses by {@link com.example.transformationhub.api.GlobalExceptionHandler}.
 * </p>
 */
public abstract class CoreException extends RuntimeException {

    protected CoreException(String message) {
        super(message);
    }

    protected CoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the caller may retry after re-reading current state. */
    public boolean isRetryable() {
        return false;
    }
}
