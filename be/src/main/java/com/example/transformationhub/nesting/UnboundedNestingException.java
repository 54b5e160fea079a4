package com.example.transformationhub.nesting;

import com.example.transformationhub.error.CoreException;

import lombok.Getter;

import java.util.UUID;

/**
 * Stored nesting data describes a workflow that contains itself, or nests deeper than allowed.
 * Validation keeps such data out of the store, so this signals an internal-consistency defect.
 */
@Getter
public class UnboundedNestingException extends CoreException {

    private final UUID workflowId;

    public UnboundedNestingException(UUID workflowId, String message) {
        super("Unbounded nesting for workflow " + workflowId + ": " + message);
        this.workflowId = workflowId;
    }
}
