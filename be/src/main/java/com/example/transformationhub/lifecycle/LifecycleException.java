package com.example.transformationhub.lifecycle;

import com.example.transformationhub.error.CoreException;
import com.example.transformationhub.model.RevisionState;

import lombok.Getter;

/**
 * A write the revision lifecycle does not permit. Carries the stored and the requested state.
 */
@Getter
public abstract class LifecycleException extends CoreException {

    private final RevisionState currentState;
    private final RevisionState requestedState;

    protected LifecycleException(RevisionState currentState, RevisionState requestedState, String message) {
        super(message);
        this.currentState = currentState;
        this.requestedState = requestedState;
    }
}
