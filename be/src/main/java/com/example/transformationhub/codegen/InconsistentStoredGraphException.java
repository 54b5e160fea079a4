package com.example.transformationhub.codegen;

import com.example.transformationhub.validation.StructuralException;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A stored revision turned out structurally broken while being compiled: an operator cycle,
 * revisions nesting each other, or a workflow without a graph.
 * <p>
 * Validation keeps such data out of the store, so this signals an internal-consistency defect
 * rather than a bad request.
 * </p>
 */
public class InconsistentStoredGraphException extends StructuralException {

    public InconsistentStoredGraphException(String field, List<UUID> cyclePath) {
        super(field, "cycle detected in stored data: "
                + cyclePath.stream().map(UUID::toString).collect(Collectors.joining(" -> ")), cyclePath);
    }

    public InconsistentStoredGraphException(UUID transformationId, String message) {
        super("graph", message + ": " + transformationId, List.of());
    }
}
