package com.example.transformationhub.validation;

import com.example.transformationhub.model.Connector;
import com.example.transformationhub.model.Constant;
import com.example.transformationhub.model.DataType;
import com.example.transformationhub.model.Link;
import com.example.transformationhub.model.LinkEndpoint;
import com.example.transformationhub.model.Operator;
import com.example.transformationhub.model.WorkflowGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Array-backed view of a workflow graph: operators are addressed by their declaration index and
 * operator-to-operator dependencies are kept as sorted successor lists.
 * <p>
 * Instances are immutable after construction and may be shared between threads.
 * </p>
 */
public final class GraphIndex {

    private final WorkflowGraph graph;
    private final Map<UUID, Integer> operatorIndex = new HashMap<>();
    private final Map<UUID, Connector> workflowInputs = new HashMap<>();
    private final Map<UUID, Constant> constants = new HashMap<>();
    private final Map<UUID, Connector> workflowOutputs = new HashMap<>();
    private final List<List<Integer>> successors;

    public GraphIndex(WorkflowGraph graph) {
        this.graph = graph;
        List<Operator> operators = graph.operators();
        for (int i = 0; i < operators.size(); i++) {
            operatorIndex.putIfAbsent(operators.get(i).id(), i);
        }
        graph.inputs().forEach(c -> workflowInputs.putIfAbsent(c.id(), c));
        graph.constants().forEach(c -> constants.putIfAbsent(c.id(), c));
        graph.outputs().forEach(c -> workflowOutputs.putIfAbsent(c.id(), c));

        List<TreeSet<Integer>> edges = new ArrayList<>();
        for (int i = 0; i < operators.size(); i++) {
            edges.add(new TreeSet<>());
        }
        for (Link link : graph.links()) {
            Integer from = link.start().operatorId() != null ? operatorIndex.get(link.start().operatorId()) : null;
            Integer to = link.end().operatorId() != null ? operatorIndex.get(link.end().operatorId()) : null;
            if (from != null && to != null) {
                edges.get(from).add(to);
            }
        }
        List<List<Integer>> frozen = new ArrayList<>(edges.size());
        for (TreeSet<Integer> e : edges) {
            frozen.add(List.copyOf(e));
        }
        this.successors = Collections.unmodifiableList(frozen);
    }

    public WorkflowGraph graph() {
        return graph;
    }

    public int operatorCount() {
        return graph.operators().size();
    }

    public Operator operator(int index) {
        return graph.operators().get(index);
    }

    public Optional<Operator> operator(UUID operatorId) {
        Integer index = operatorIndex.get(operatorId);
        return index != null ? Optional.of(graph.operators().get(index)) : Optional.empty();
    }

    public Optional<Connector> workflowInput(UUID connectorId) {
        return Optional.ofNullable(workflowInputs.get(connectorId));
    }

    public Optional<Constant> constant(UUID connectorId) {
        return Optional.ofNullable(constants.get(connectorId));
    }

    public Optional<Connector> workflowOutput(UUID connectorId) {
        return Optional.ofNullable(workflowOutputs.get(connectorId));
    }

    /** Type provided by a link start, if it names a workflow input, a constant or an operator output. */
    public Optional<DataType> sourceType(LinkEndpoint start) {
        if (start.isWorkflowLevel()) {
            Connector input = workflowInputs.get(start.connectorId());
            if (input != null) {
                return Optional.of(input.dataType());
            }
            Constant constant = constants.get(start.connectorId());
            return constant != null ? Optional.of(constant.dataType()) : Optional.empty();
        }
        return operator(start.operatorId())
                .flatMap(op -> op.output(start.connectorId()))
                .map(Connector::dataType);
    }

    /** Connector a link end arrives at, if it names a workflow output or an operator input. */
    public Optional<Connector> destination(LinkEndpoint end) {
        if (end.isWorkflowLevel()) {
            return workflowOutput(end.connectorId());
        }
        return operator(end.operatorId()).flatMap(op -> op.input(end.connectorId()));
    }

    /**
     * Depth-first search over operators with an explicit recursion stack. Returns the operator
     * indices of the first cycle found, from the revisited operator back to itself.
     */
    public Optional<List<Integer>> findCycle() {
        int n = operatorCount();
        int[] color = new int[n];
        List<Integer> stack = new ArrayList<>();
        for (int start = 0; start < n; start++) {
            if (color[start] == 0) {
                List<Integer> cycle = visit(start, color, stack);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<Integer> visit(int node, int[] color, List<Integer> stack) {
        color[node] = 1;
        stack.add(node);
        for (int next : successors.get(node)) {
            if (color[next] == 1) {
                List<Integer> cycle = new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                cycle.add(next);
                return cycle;
            }
            if (color[next] == 0) {
                List<Integer> cycle = visit(next, color, stack);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        stack.remove(stack.size() - 1);
        color[node] = 2;
        return null;
    }

    /**
     * Kahn's algorithm; among ready operators the one declared first goes first.
     * Returns fewer than {@link #operatorCount()} indices when the operators contain a cycle.
     */
    public List<Integer> topologicalOrder() {
        int n = operatorCount();
        int[] inDegree = new int[n];
        for (List<Integer> next : successors) {
            for (int to : next) {
                inDegree[to]++;
            }
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        List<Integer> order = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(current);
            for (int next : successors.get(current)) {
                if (--inDegree[next] == 0) {
                    ready.add(next);
                }
            }
        }
        return order;
    }

    public List<UUID> operatorIds(List<Integer> indices) {
        return indices.stream().map(i -> operator(i).id()).toList();
    }
}
