package com.example.transformationhub.validation;

import com.example.transformationhub.model.Connector;
import com.example.transformationhub.model.Constant;
import com.example.transformationhub.model.DataType;
import com.example.transformationhub.model.InputWiring;
import com.example.transformationhub.model.IoInterface;
import com.example.transformationhub.model.Link;
import com.example.transformationhub.model.LinkEndpoint;
import com.example.transformationhub.model.Operator;
import com.example.transformationhub.model.OutputWiring;
import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.model.Wiring;
import com.example.transformationhub.model.WorkflowGraph;
import com.example.transformationhub.store.RevisionStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Validates a transformation revision before it is stored: interface and wiring consistency for
 * every revision, and for workflows the graph itself (references, connectivity, types, cycles).
 * <p>
 * Checks run in a fixed order and the first failing category is thrown as its typed exception.
 * </p>
 */
public final class WorkflowGraphValidator {

    private WorkflowGraphValidator() {
    }

    /**
     * Validates the revision. Referenced revisions are read from {@code store}.
     *
     * @throws WorkflowGraphValidationException or one of its subtypes if invalid
     */
    public static void validate(TransformationRevision revision, RevisionStore store) {
        switch (revision.type()) {
            case COMPONENT -> validateComponent(revision);
            case WORKFLOW -> validateWorkflow(revision, store);
        }
    }

    private static void validateComponent(TransformationRevision revision) {
        List<ValidationError> errors = new ArrayList<>();
        if (revision.code() == null) {
            errors.add(new ValidationError("code", "a component requires code"));
        }
        if (revision.graph() != null) {
            errors.add(new ValidationError("graph", "a component must not carry a workflow graph"));
        }
        validateInterfaceNames(revision.ioInterface(), errors);
        validateWiring(revision, errors);
        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }
    }

    private static void validateWorkflow(TransformationRevision revision, RevisionStore store) {
        List<ValidationError> errors = new ArrayList<>();
        WorkflowGraph graph = revision.graph();
        if (graph == null) {
            throw new WorkflowGraphValidationException("graph", "a workflow requires a graph");
        }
        if (revision.code() != null) {
            errors.add(new ValidationError("code", "a workflow must not carry component code"));
        }
        validateUniqueIds(graph, errors);
        validateInterfaceNames(revision.ioInterface(), errors);
        if (!graph.ioInterface().withoutPositions().equals(revision.ioInterface().withoutPositions())) {
            errors.add(new ValidationError("ioInterface", "io interface must match the graph's inputs and outputs"));
        }
        validateWiring(revision, errors);
        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }

        GraphIndex index = new GraphIndex(graph);
        validateReferences(revision, store);
        validateConnectivity(index);
        validateTypes(index);
        validateAcyclic(index);
        validateNoReferenceCycle(revision, store);
    }

    private static void validateUniqueIds(WorkflowGraph graph, List<ValidationError> errors) {
        Set<UUID> workflowConnectors = new HashSet<>();
        for (Connector c : graph.inputs()) {
            requireUnique(workflowConnectors, c.id(), "graph.inputs", errors);
        }
        for (Constant c : graph.constants()) {
            requireUnique(workflowConnectors, c.id(), "graph.constants", errors);
        }
        for (Connector c : graph.outputs()) {
            requireUnique(workflowConnectors, c.id(), "graph.outputs", errors);
        }
        Set<UUID> operatorIds = new HashSet<>();
        for (Operator op : graph.operators()) {
            requireUnique(operatorIds, op.id(), "graph.operators", errors);
            Set<UUID> operatorConnectors = new HashSet<>();
            String prefix = "operators[" + op.id() + "]";
            op.inputs().forEach(c -> requireUnique(operatorConnectors, c.id(), prefix + ".inputs", errors));
            op.outputs().forEach(c -> requireUnique(operatorConnectors, c.id(), prefix + ".outputs", errors));
        }
        Set<UUID> linkIds = new HashSet<>();
        for (Link link : graph.links()) {
            requireUnique(linkIds, link.id(), "graph.links", errors);
        }
    }

    private static void requireUnique(Set<UUID> seen, UUID id, String field, List<ValidationError> errors) {
        if (!seen.add(id)) {
            errors.add(new ValidationError(field, "duplicate id " + id));
        }
    }

    private static void validateInterfaceNames(IoInterface io, List<ValidationError> errors) {
        Set<String> inputs = new HashSet<>();
        for (Connector c : io.inputs()) {
            if (!inputs.add(c.name())) {
                errors.add(new ValidationError("ioInterface.inputs", "duplicate input name '" + c.name() + "'"));
            }
        }
        Set<String> outputs = new HashSet<>();
        for (Connector c : io.outputs()) {
            if (!outputs.add(c.name())) {
                errors.add(new ValidationError("ioInterface.outputs", "duplicate output name '" + c.name() + "'"));
            }
        }
    }

    /**
     * Checks that a wiring only names connectors of {@code io}.
     *
     * @throws WorkflowGraphValidationException listing every unknown name
     */
    public static void validateWiring(IoInterface io, Wiring wiring) {
        List<ValidationError> errors = new ArrayList<>();
        collectWiringErrors(io, wiring, errors);
        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }
    }

    private static void validateWiring(TransformationRevision revision, List<ValidationError> errors) {
        collectWiringErrors(revision.ioInterface(), revision.testWiring(), errors);
    }

    private static void collectWiringErrors(IoInterface io, Wiring wiring, List<ValidationError> errors) {
        for (InputWiring input : wiring.inputWirings()) {
            if (io.input(input.workflowInputName()).isEmpty()) {
                errors.add(new ValidationError("wiring.inputWirings",
                        "no input named '" + input.workflowInputName() + "'"));
            }
        }
        for (OutputWiring output : wiring.outputWirings()) {
            if (io.output(output.workflowOutputName()).isEmpty()) {
                errors.add(new ValidationError("wiring.outputWirings",
                        "no output named '" + output.workflowOutputName() + "'"));
            }
        }
    }

    private static void validateReferences(TransformationRevision revision, RevisionStore store) {
        for (Operator op : revision.graph().operators()) {
            if (op.transformationId().equals(revision.id())) {
                throw new StructuralException("operators[" + op.id() + "].transformationId",
                        List.of(revision.id(), revision.id()));
            }
            Optional<TransformationRevision> target = store.get(op.transformationId());
            if (target.isEmpty()) {
                throw new DanglingReferenceException(op.id(), op.transformationId(), "revision does not exist");
            }
            if (revision.state() == RevisionState.RELEASED && target.get().state() == RevisionState.DISABLED) {
                throw new DanglingReferenceException(op.id(), op.transformationId(),
                        "a released workflow may not use a disabled revision");
            }
        }
    }

    private static void validateConnectivity(GraphIndex index) {
        Map<LinkEndpoint, UUID> incoming = new HashMap<>();
        for (Link link : index.graph().links()) {
            if (index.sourceType(link.start()).isEmpty()) {
                throw new ConnectivityException(link.start().describe(),
                        "link " + link.id() + " does not start at a workflow input, constant or operator output");
            }
            if (index.destination(link.end()).isEmpty()) {
                throw new ConnectivityException(link.end().describe(),
                        "link " + link.id() + " does not end at a workflow output or operator input");
            }
            UUID previous = incoming.putIfAbsent(link.end(), link.id());
            if (previous != null) {
                throw new ConnectivityException(link.end().describe(),
                        "connector has more than one incoming link: " + previous + ", " + link.id());
            }
        }
        for (Operator op : index.graph().operators()) {
            for (Connector input : op.inputs()) {
                if (!input.hasDefaultValue() && !incoming.containsKey(LinkEndpoint.operator(op.id(), input.id()))) {
                    throw new ConnectivityException(LinkEndpoint.operator(op.id(), input.id()).describe(),
                            "input '" + input.name() + "' of operator " + op.displayName() + " is not linked");
                }
            }
        }
        for (Connector output : index.graph().outputs()) {
            if (!incoming.containsKey(LinkEndpoint.workflow(output.id()))) {
                throw new ConnectivityException(LinkEndpoint.workflow(output.id()).describe(),
                        "workflow output '" + output.name() + "' is not linked");
            }
        }
    }

    private static void validateTypes(GraphIndex index) {
        for (Link link : index.graph().links()) {
            DataType actual = index.sourceType(link.start()).orElseThrow();
            DataType expected = index.destination(link.end()).orElseThrow().dataType();
            if (!expected.accepts(actual)) {
                throw new TypeMismatchException(link.id(), expected, actual);
            }
        }
    }

    private static void validateAcyclic(GraphIndex index) {
        Optional<List<Integer>> cycle = index.findCycle();
        if (cycle.isPresent()) {
            throw new StructuralException("graph.links", index.operatorIds(cycle.get()));
        }
    }

    /**
     * Follows operator references into stored workflows with a recursion stack of revision ids.
     * The revision under validation contributes its submitted graph, not the stored one.
     */
    private static void validateNoReferenceCycle(TransformationRevision revision, RevisionStore store) {
        Deque<UUID> stack = new ArrayDeque<>();
        stack.addLast(revision.id());
        visitReferences(revision.graph(), stack, new HashSet<>(), store);
    }

    private static void visitReferences(WorkflowGraph graph, Deque<UUID> stack, Set<UUID> done, RevisionStore store) {
        Set<UUID> targets = new LinkedHashSet<>();
        graph.operators().forEach(op -> targets.add(op.transformationId()));
        for (UUID target : targets) {
            if (stack.contains(target)) {
                List<UUID> path = new ArrayList<>(stack);
                List<UUID> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                cycle.add(target);
                throw new StructuralException("graph.operators", cycle);
            }
            if (!done.add(target)) {
                continue;
            }
            Optional<TransformationRevision> referenced = store.get(target);
            if (referenced.isPresent() && referenced.get().isWorkflow() && referenced.get().graph() != null) {
                stack.addLast(target);
                visitReferences(referenced.get().graph(), stack, done, store);
                stack.removeLast();
            }
        }
    }
}
