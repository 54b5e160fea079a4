package com.example.transformationhub.lifecycle;

import com.example.transformationhub.model.RevisionState;

public class ImmutableRevisionException extends LifecycleException {

    public ImmutableRevisionException() {
        super(RevisionState.RELEASED, RevisionState.RELEASED,
                "Cannot modify a released transformation revision without allowOverwriteReleased");
    }
}
