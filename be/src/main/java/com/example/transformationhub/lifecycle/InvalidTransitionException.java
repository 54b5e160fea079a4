package com.example.transformationhub.lifecycle;

import com.example.transformationhub.model.RevisionState;

public class InvalidTransitionException extends LifecycleException {

    public InvalidTransitionException(RevisionState currentState, RevisionState requestedState) {
        super(currentState, requestedState,
                String.format("Invalid state transition: %s → %s", currentState, requestedState));
    }
}
