package com.example.transformationhub.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a transformation revision is not found by id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class TransformationNotFoundException extends RuntimeException {

    private final UUID transformationId;

    public TransformationNotFoundException(UUID transformationId) {
        super("Found no transformation revision with id " + transformationId);
        this.transformationId = transformationId;
    }
}
