package com.example.transformationhub.model;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Binds a workflow input to an adapter, e.g. {@code direct_provisioning} with {@code filters.value}.
 */
public record InputWiring(@NotBlank String workflowInputName, @NotBlank String adapterId, Map<String, String> filters) {

    public InputWiring {
        filters = filters != null ? Map.copyOf(filters) : Map.of();
    }
}
