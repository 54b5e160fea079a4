package com.example.transformationhub.service;

import com.example.transformationhub.error.CoreException;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown by create when a revision with the same id is already stored.
 */
@Getter
public class TransformationAlreadyExistsException extends CoreException {

    private final UUID transformationId;

    public TransformationAlreadyExistsException(UUID transformationId) {
        super("Transformation revision " + transformationId + " already exists");
        this.transformationId = transformationId;
    }
}
