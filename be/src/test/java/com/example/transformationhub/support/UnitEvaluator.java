package com.example.transformationhub.support;

import com.example.transformationhub.codegen.ExecutableUnit;
import com.example.transformationhub.codegen.ExecutionStep;
import com.example.transformationhub.codegen.ValueSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs an {@link ExecutableUnit} in-process the way an external executor would, with component
 * bodies replaced by Java functions keyed by transformation id.
 */
public class UnitEvaluator {

    private final Map<UUID, Function<Map<String, Object>, Map<String, Object>>> components = new HashMap<>();

    public UnitEvaluator component(UUID transformationId, Function<Map<String, Object>, Map<String, Object>> body) {
        components.put(transformationId, body);
        return this;
    }

    public Map<String, Object> evaluate(ExecutableUnit unit, Map<String, Object> inputs) {
        return switch (unit.type()) {
            case COMPONENT -> {
                Function<Map<String, Object>, Map<String, Object>> body = components.get(unit.transformationId());
                if (body == null) {
                    throw new IllegalStateException("no body for component " + unit.transformationId());
                }
                yield body.apply(inputs);
            }
            case WORKFLOW -> evaluateWorkflow(unit, inputs);
        };
    }

    private Map<String, Object> evaluateWorkflow(ExecutableUnit unit, Map<String, Object> inputs) {
        Map<UUID, Map<String, Object>> results = new HashMap<>();
        for (ExecutionStep step : unit.steps()) {
            Map<String, Object> bound = new LinkedHashMap<>();
            step.inputs().forEach((name, source) -> bound.put(name, resolve(source, inputs, results)));
            results.put(step.operatorId(), evaluate(step.unit(), bound));
        }
        Map<String, Object> outputs = new LinkedHashMap<>();
        unit.outputs().forEach((name, source) -> outputs.put(name, resolve(source, inputs, results)));
        return outputs;
    }

    private static Object resolve(ValueSource source, Map<String, Object> inputs, Map<UUID, Map<String, Object>> results) {
        return switch (source.kind()) {
            case WORKFLOW_INPUT -> inputs.get(source.workflowInput());
            case OPERATOR_OUTPUT -> results.get(source.operatorId()).get(source.connectorName());
            case CONSTANT, DEFAULT -> source.value();
        };
    }
}
