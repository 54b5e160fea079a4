package com.example.transformationhub.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Objects;
import java.util.UUID;

/**
 * A named, typed input or output slot on a revision, an operator or a workflow graph.
 * <p>
 * {@code defaultValue} makes an operator input optional; {@code position} only matters to the editor.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Connector(
        @NotNull UUID id,
        @NotBlank String name,
        @NotNull DataType dataType,
        String defaultValue,
        Position position
) {
    public Connector {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dataType, "dataType");
    }

    public static Connector of(UUID id, String name, DataType dataType) {
        return new Connector(id, name, dataType, null, null);
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public Connector withoutPosition() {
        return position == null ? this : new Connector(id, name, dataType, defaultValue, null);
    }
}
