package com.example.transformationhub.codegen;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.UUID;

/**
 * Where a bound input or a workflow output takes its value from at execution time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueSource(Kind kind, String workflowInput, UUID operatorId, String connectorName, String value) {

    public enum Kind {
        /** Value the executor binds to the named workflow input. */
        WORKFLOW_INPUT,
        /** Named output of an earlier step. */
        OPERATOR_OUTPUT,
        /** Constant placed in the graph. */
        CONSTANT,
        /** Default value of an unlinked operator input. */
        DEFAULT
    }

    public ValueSource {
        Objects.requireNonNull(kind, "kind");
    }

    public static ValueSource workflowInput(String name) {
        return new ValueSource(Kind.WORKFLOW_INPUT, name, null, null, null);
    }

    public static ValueSource operatorOutput(UUID operatorId, String connectorName) {
        return new ValueSource(Kind.OPERATOR_OUTPUT, null, operatorId, connectorName, null);
    }

    public static ValueSource constant(String value) {
        return new ValueSource(Kind.CONSTANT, null, null, null, value);
    }

    public static ValueSource defaultValue(String value) {
        return new ValueSource(Kind.DEFAULT, null, null, null, value);
    }
}
