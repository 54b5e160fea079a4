package com.example.transformationhub.validation;

import lombok.Getter;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A cycle among operators, or among revisions referencing each other.
 * The path starts and ends with the same id.
 */
@Getter
public class StructuralException extends WorkflowGraphValidationException {

    private final List<UUID> cyclePath;

    public StructuralException(String field, List<UUID> cyclePath) {
        super(field, "cycle detected: " + cyclePath.stream().map(UUID::toString).collect(Collectors.joining(" -> ")));
        this.cyclePath = List.copyOf(cyclePath);
    }

    protected StructuralException(String field, String message, List<UUID> cyclePath) {
        super(field, message);
        this.cyclePath = List.copyOf(cyclePath);
    }
}
