package com.example.transformationhub.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Invocation of one operator's compiled unit with its inputs bound by connector name.
 */
public record ExecutionStep(UUID operatorId, String operatorName, ExecutableUnit unit, Map<String, ValueSource> inputs) {

    public ExecutionStep {
        Objects.requireNonNull(operatorId, "operatorId");
        Objects.requireNonNull(unit, "unit");
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }
}
