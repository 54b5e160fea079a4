package com.example.transformationhub.model;

import jakarta.validation.Valid;

import java.util.List;

/**
 * Content of a workflow revision: connectors, constants, operators and the links between them.
 */
public record WorkflowGraph(
        @Valid List<Connector> inputs,
        @Valid List<Connector> outputs,
        @Valid List<Constant> constants,
        @Valid List<Operator> operators,
        @Valid List<Link> links
) {
    public WorkflowGraph {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        constants = constants != null ? List.copyOf(constants) : List.of();
        operators = operators != null ? List.copyOf(operators) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
    }

    /** The io interface this graph exposes: its inputs and outputs, constants excluded. */
    public IoInterface ioInterface() {
        return new IoInterface(inputs, outputs);
    }
}
