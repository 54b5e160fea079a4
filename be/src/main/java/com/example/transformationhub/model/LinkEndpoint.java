package com.example.transformationhub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;

import java.util.Objects;
import java.util.UUID;

/**
 * One end of a link. Without {@code operatorId} the connector belongs to the workflow itself
 * (an input or constant at the start of a link, an output at its end).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinkEndpoint(UUID operatorId, @NotNull UUID connectorId) {

    public LinkEndpoint {
        Objects.requireNonNull(connectorId, "connectorId");
    }

    public static LinkEndpoint workflow(UUID connectorId) {
        return new LinkEndpoint(null, connectorId);
    }

    public static LinkEndpoint operator(UUID operatorId, UUID connectorId) {
        return new LinkEndpoint(operatorId, connectorId);
    }

    @JsonIgnore
    public boolean isWorkflowLevel() {
        return operatorId == null;
    }

    public String describe() {
        return isWorkflowLevel() ? "workflow:" + connectorId : "operator:" + operatorId + "/" + connectorId;
    }
}
