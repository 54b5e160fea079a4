package com.example.transformationhub.codegen;

import com.example.transformationhub.error.CoreException;

import lombok.Getter;

import java.util.UUID;

/**
 * A revision referenced by an operator cannot be loaded or does not fit the operator.
 * Reflects stored-data integrity; not retried.
 */
@Getter
public class UnresolvedDependencyException extends CoreException {

    private final UUID operatorId;
    private final UUID transformationId;

    public UnresolvedDependencyException(UUID operatorId, UUID transformationId, String reason) {
        super("Cannot resolve " + transformationId + " for operator " + operatorId + ": " + reason);
        this.operatorId = operatorId;
        this.transformationId = transformationId;
    }

    /** The referenced revision exists but does not compile itself. */
    public UnresolvedDependencyException(UUID operatorId, UUID transformationId, CoreException cause) {
        super("Cannot resolve " + transformationId + " for operator " + operatorId + ": " + cause.getMessage(), cause);
        this.operatorId = operatorId;
        this.transformationId = transformationId;
    }
}
