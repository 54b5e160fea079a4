package com.example.transformationhub.codegen;

import com.example.transformationhub.error.CoreException;
import com.example.transformationhub.model.Connector;
import com.example.transformationhub.model.Constant;
import com.example.transformationhub.model.Link;
import com.example.transformationhub.model.LinkEndpoint;
import com.example.transformationhub.model.Operator;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.store.RevisionStore;
import com.example.transformationhub.validation.ConnectivityException;
import com.example.transformationhub.validation.GraphIndex;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns a validated revision into an {@link ExecutableUnit}.
 * <p>
 * Workflows are compiled recursively: each operator's referenced revision is loaded from the
 * store and compiled once per top-level call, then bound to that operator's inputs. Operators
 * run in topological order, ties broken by declaration order, so equal graphs compile to equal
 * units.
 * </p>
 */
@Slf4j
public class WorkflowCodeGenerator {

    private final RevisionStore store;

    public WorkflowCodeGenerator(RevisionStore store) {
        this.store = store;
    }

    /**
     * Compiles {@code revision} and everything it nests.
     *
     * @throws UnresolvedDependencyException if a referenced revision is missing, does not compile or
     *         does not fit its operator
     * @throws InconsistentStoredGraphException if operators or nested revisions form a cycle
     */
    public ExecutableUnit compile(TransformationRevision revision) {
        return compileTracked(revision).unit();
    }

    /** Like {@link #compile}, also returning the revisions that were read, the root included. */
    public CompilationResult compileTracked(TransformationRevision revision) {
        Compilation compilation = new Compilation();
        compilation.read.put(revision.id(), revision);
        ExecutableUnit unit = compilation.compile(revision);
        log.debug("Compiled transformationId={} dependencies={}", revision.id(), compilation.read.size() - 1);
        return new CompilationResult(unit, compilation.read);
    }

    /** State of one top-level call; never shared between calls. */
    private final class Compilation {

        private final Map<UUID, ExecutableUnit> memo = new HashMap<>();
        private final Set<UUID> inProgress = new LinkedHashSet<>();
        private final Map<UUID, TransformationRevision> read = new LinkedHashMap<>();

        ExecutableUnit compile(TransformationRevision revision) {
            return switch (revision.type()) {
                case COMPONENT -> ExecutableUnit.component(revision);
                case WORKFLOW -> compileWorkflow(revision);
            };
        }

        private ExecutableUnit compileWorkflow(TransformationRevision workflow) {
            if (workflow.graph() == null) {
                throw new InconsistentStoredGraphException(workflow.id(), "stored workflow has no graph");
            }
            inProgress.add(workflow.id());
            GraphIndex index = new GraphIndex(workflow.graph());
            List<Integer> order = index.topologicalOrder();
            if (order.size() < index.operatorCount()) {
                List<UUID> cycle = index.findCycle().map(index::operatorIds).orElse(List.of());
                log.error("Stored workflow has an operator cycle transformationId={} cycle={}", workflow.id(), cycle);
                throw new InconsistentStoredGraphException("graph.links", cycle);
            }

            Map<LinkEndpoint, LinkEndpoint> sourceByEnd = new HashMap<>();
            for (Link link : workflow.graph().links()) {
                sourceByEnd.put(link.end(), link.start());
            }

            List<ExecutionStep> steps = new ArrayList<>(order.size());
            for (int i : order) {
                Operator op = index.operator(i);
                ExecutableUnit unit = resolve(op);
                for (Connector output : op.outputs()) {
                    if (unit.ioInterface().output(output.name()).isEmpty()) {
                        throw new UnresolvedDependencyException(op.id(), op.transformationId(),
                                "no output named '" + output.name() + "'");
                    }
                }
                Map<String, ValueSource> inputs = new LinkedHashMap<>();
                for (Connector input : op.inputs()) {
                    if (unit.ioInterface().input(input.name()).isEmpty()) {
                        throw new UnresolvedDependencyException(op.id(), op.transformationId(),
                                "no input named '" + input.name() + "'");
                    }
                    LinkEndpoint source = sourceByEnd.get(LinkEndpoint.operator(op.id(), input.id()));
                    if (source != null) {
                        inputs.put(input.name(), valueSource(index, source));
                    } else if (input.hasDefaultValue()) {
                        inputs.put(input.name(), ValueSource.defaultValue(input.defaultValue()));
                    } else {
                        throw new ConnectivityException(LinkEndpoint.operator(op.id(), input.id()).describe(),
                                "input '" + input.name() + "' of operator " + op.displayName() + " is not linked");
                    }
                }
                for (Connector required : unit.ioInterface().inputs()) {
                    if (!required.hasDefaultValue() && !inputs.containsKey(required.name())) {
                        throw new UnresolvedDependencyException(op.id(), op.transformationId(),
                                "required input '" + required.name() + "' is not bound");
                    }
                }
                steps.add(new ExecutionStep(op.id(), op.name(), unit, inputs));
            }

            Map<String, ValueSource> outputs = new LinkedHashMap<>();
            for (Connector output : workflow.graph().outputs()) {
                LinkEndpoint source = sourceByEnd.get(LinkEndpoint.workflow(output.id()));
                if (source == null) {
                    throw new ConnectivityException(LinkEndpoint.workflow(output.id()).describe(),
                            "workflow output '" + output.name() + "' is not linked");
                }
                outputs.put(output.name(), valueSource(index, source));
            }
            inProgress.remove(workflow.id());
            return ExecutableUnit.workflow(workflow, steps, outputs);
        }

        private ExecutableUnit resolve(Operator op) {
            UUID target = op.transformationId();
            ExecutableUnit cached = memo.get(target);
            if (cached != null) {
                return cached;
            }
            if (inProgress.contains(target)) {
                List<UUID> path = new ArrayList<>(inProgress);
                List<UUID> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                cycle.add(target);
                log.error("Stored revisions nest each other transformationId={} cycle={}", target, cycle);
                throw new InconsistentStoredGraphException("graph.operators", cycle);
            }
            Optional<TransformationRevision> referenced = store.get(target);
            if (referenced.isEmpty()) {
                throw new UnresolvedDependencyException(op.id(), target, "revision does not exist");
            }
            read.put(target, referenced.get());
            ExecutableUnit unit;
            try {
                unit = compile(referenced.get());
            } catch (InconsistentStoredGraphException e) {
                throw e;
            } catch (CoreException e) {
                throw new UnresolvedDependencyException(op.id(), target, e);
            }
            memo.put(target, unit);
            return unit;
        }

        private ValueSource valueSource(GraphIndex index, LinkEndpoint start) {
            if (start.isWorkflowLevel()) {
                Optional<Connector> input = index.workflowInput(start.connectorId());
                if (input.isPresent()) {
                    return ValueSource.workflowInput(input.get().name());
                }
                Optional<Constant> constant = index.constant(start.connectorId());
                if (constant.isPresent()) {
                    return ValueSource.constant(constant.get().value());
                }
            } else {
                Optional<Connector> output = index.operator(start.operatorId())
                        .flatMap(op -> op.output(start.connectorId()));
                if (output.isPresent()) {
                    return ValueSource.operatorOutput(start.operatorId(), output.get().name());
                }
            }
            throw new ConnectivityException(start.describe(), "link source does not exist");
        }
    }
}
