package com.example.transformationhub.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.Objects;
import java.util.UUID;

/**
 * Directed wire from one source connector to one destination connector.
 */
public record Link(@NotNull UUID id, @NotNull @Valid LinkEndpoint start, @NotNull @Valid LinkEndpoint end) {

    public Link {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }
}
