package com.example.transformationhub.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A placed reference to another transformation revision inside a workflow graph.
 * <p>
 * {@code inputs} and {@code outputs} are the referenced revision's connectors as they were when the
 * operator was placed.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Operator(
        @NotNull UUID id,
        @NotNull UUID transformationId,
        String name,
        @Valid List<Connector> inputs,
        @Valid List<Connector> outputs,
        Position position
) {
    public Operator {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(transformationId, "transformationId");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public Optional<Connector> input(UUID connectorId) {
        return inputs.stream().filter(c -> c.id().equals(connectorId)).findFirst();
    }

    public Optional<Connector> output(UUID connectorId) {
        return outputs.stream().filter(c -> c.id().equals(connectorId)).findFirst();
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id.toString();
    }
}
