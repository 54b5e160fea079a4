package com.example.transformationhub.validation;

import lombok.Getter;

import java.util.UUID;

/**
 * An operator references a revision that does not exist, or one a released workflow may not use.
 */
@Getter
public class DanglingReferenceException extends WorkflowGraphValidationException {

    private final UUID operatorId;
    private final UUID transformationId;

    public DanglingReferenceException(UUID operatorId, UUID transformationId, String reason) {
        super("operators[" + operatorId + "].transformationId",
                "operator " + operatorId + " references " + transformationId + ": " + reason);
        this.operatorId = operatorId;
        this.transformationId = transformationId;
    }
}
