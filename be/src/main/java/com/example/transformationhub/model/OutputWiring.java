package com.example.transformationhub.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Binds a workflow output to an adapter.
 */
public record OutputWiring(@NotBlank String workflowOutputName, @NotBlank String adapterId) {
}
