package com.example.transformationhub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One versioned unit: a component (opaque {@code code}) or a workflow ({@code graph}).
 * <p>
 * {@link #type()} is the tag that decides which of {@code code} and {@code graph} is set; callers
 * switch on it rather than probing for null.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransformationRevision(
        @NotNull UUID id,
        @NotNull UUID revisionGroupId,
        @NotBlank String name,
        String description,
        String category,
        String documentation,
        @NotBlank String versionTag,
        @NotNull TransformationType type,
        @NotNull RevisionState state,
        Instant releasedTimestamp,
        Instant disabledTimestamp,
        @Valid IoInterface ioInterface,
        String code,
        @Valid WorkflowGraph graph,
        @Valid Wiring testWiring
) {
    public TransformationRevision {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(revisionGroupId, "revisionGroupId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(versionTag, "versionTag");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(state, "state");
        ioInterface = ioInterface != null ? ioInterface : IoInterface.empty();
        testWiring = testWiring != null ? testWiring : Wiring.empty();
    }

    @JsonIgnore
    public boolean isWorkflow() {
        return type == TransformationType.WORKFLOW;
    }

    public TransformationRevision withState(RevisionState newState, Instant released, Instant disabled) {
        return new TransformationRevision(id, revisionGroupId, name, description, category, documentation,
                versionTag, type, newState, released, disabled, ioInterface, code, graph, testWiring);
    }
}
