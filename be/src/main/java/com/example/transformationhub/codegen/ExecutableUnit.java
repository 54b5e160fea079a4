package com.example.transformationhub.codegen;

import com.example.transformationhub.model.IoInterface;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.model.TransformationType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Compiled, runnable artifact handed to an external executor.
 * <p>
 * A component unit carries its {@code code}. A workflow unit carries {@code steps} in execution
 * order and the source of each workflow output; nested workflows appear as steps whose unit is
 * itself a workflow unit. The interface is the revision's io interface without positions.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutableUnit(
        UUID transformationId,
        String name,
        String versionTag,
        TransformationType type,
        IoInterface ioInterface,
        String code,
        List<ExecutionStep> steps,
        Map<String, ValueSource> outputs
) {
    public ExecutableUnit {
        Objects.requireNonNull(transformationId, "transformationId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(ioInterface, "ioInterface");
        steps = steps != null ? List.copyOf(steps) : null;
        outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : null;
    }

    static ExecutableUnit component(TransformationRevision revision) {
        return new ExecutableUnit(revision.id(), revision.name(), revision.versionTag(), TransformationType.COMPONENT,
                revision.ioInterface().withoutPositions(), revision.code(), null, null);
    }

    static ExecutableUnit workflow(TransformationRevision revision, List<ExecutionStep> steps,
                                   Map<String, ValueSource> outputs) {
        return new ExecutableUnit(revision.id(), revision.name(), revision.versionTag(), TransformationType.WORKFLOW,
                revision.ioInterface().withoutPositions(), null, steps, outputs);
    }
}
