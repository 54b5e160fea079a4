package com.example.transformationhub.codegen;

import com.example.transformationhub.model.TransformationRevision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A compiled unit together with every revision read to build it, keyed by id.
 */
public record CompilationResult(ExecutableUnit unit, Map<UUID, TransformationRevision> readRevisions) {

    public CompilationResult {
        readRevisions = Collections.unmodifiableMap(new LinkedHashMap<>(readRevisions));
    }
}
