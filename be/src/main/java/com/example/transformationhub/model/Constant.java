package com.example.transformationhub.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Objects;
import java.util.UUID;

/**
 * A fixed value placed in a workflow graph. It is a link source that stands in for a wired input
 * and is not part of the workflow's io interface.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Constant(
        @NotNull UUID id,
        @NotBlank String name,
        @NotNull DataType dataType,
        @NotNull String value,
        Position position
) {
    public Constant {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(value, "value");
    }
}
