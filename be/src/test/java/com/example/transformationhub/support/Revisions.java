package com.example.transformationhub.support;

import com.example.transformationhub.model.Connector;
import com.example.transformationhub.model.Constant;
import com.example.transformationhub.model.DataType;
import com.example.transformationhub.model.IoInterface;
import com.example.transformationhub.model.Link;
import com.example.transformationhub.model.LinkEndpoint;
import com.example.transformationhub.model.Operator;
import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.model.TransformationType;
import com.example.transformationhub.model.Wiring;
import com.example.transformationhub.model.WorkflowGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builders for test revisions.
 */
public final class Revisions {

    private Revisions() {
    }

    public static Connector connector(String name, DataType type) {
        return Connector.of(UUID.randomUUID(), name, type);
    }

    public static TransformationRevision component(String name, List<Connector> inputs, List<Connector> outputs) {
        return component(name, RevisionState.DRAFT, inputs, outputs);
    }

    public static TransformationRevision component(String name, RevisionState state,
                                                   List<Connector> inputs, List<Connector> outputs) {
        return new TransformationRevision(UUID.randomUUID(), UUID.randomUUID(), name, null, "Test", null, "1.0.0",
                TransformationType.COMPONENT, state, null, null, new IoInterface(inputs, outputs),
                "def main(**kwargs):\n    pass\n", null, Wiring.empty());
    }

    /** Component with one ANY input named {@code input} and one ANY output named {@code output}. */
    public static TransformationRevision passThrough(String name) {
        return component(name, List.of(connector("input", DataType.ANY)), List.of(connector("output", DataType.ANY)));
    }

    /** Workflow that feeds its {@code input} through one operator of {@code inner} to its {@code output}. */
    public static WorkflowBuilder wrapping(String name, TransformationRevision inner) {
        WorkflowBuilder wf = workflow(name);
        UUID in = wf.input("input", DataType.ANY);
        UUID out = wf.output("output", DataType.ANY);
        Operator op = wf.operator(inner);
        wf.link(LinkEndpoint.workflow(in), WorkflowBuilder.in(op, "input"));
        wf.link(WorkflowBuilder.out(op, "output"), LinkEndpoint.workflow(out));
        return wf;
    }

    public static WorkflowBuilder workflow(String name) {
        return new WorkflowBuilder(name);
    }

    public static final class WorkflowBuilder {

        private UUID id = UUID.randomUUID();
        private UUID revisionGroupId = UUID.randomUUID();
        private final String name;
        private String versionTag = "1.0.0";
        private RevisionState state = RevisionState.DRAFT;
        private final List<Connector> inputs = new ArrayList<>();
        private final List<Connector> outputs = new ArrayList<>();
        private final List<Constant> constants = new ArrayList<>();
        private final List<Operator> operators = new ArrayList<>();
        private final List<Link> links = new ArrayList<>();
        private Wiring testWiring = Wiring.empty();

        private WorkflowBuilder(String name) {
            this.name = name;
        }

        public WorkflowBuilder id(UUID id) {
            this.id = id;
            return this;
        }

        public WorkflowBuilder revisionGroupId(UUID revisionGroupId) {
            this.revisionGroupId = revisionGroupId;
            return this;
        }

        public WorkflowBuilder versionTag(String versionTag) {
            this.versionTag = versionTag;
            return this;
        }

        public WorkflowBuilder state(RevisionState state) {
            this.state = state;
            return this;
        }

        public WorkflowBuilder testWiring(Wiring testWiring) {
            this.testWiring = testWiring;
            return this;
        }

        public UUID input(String inputName, DataType type) {
            Connector c = connector(inputName, type);
            inputs.add(c);
            return c.id();
        }

        public UUID output(String outputName, DataType type) {
            Connector c = connector(outputName, type);
            outputs.add(c);
            return c.id();
        }

        public UUID constant(String constantName, DataType type, String value) {
            Constant c = new Constant(UUID.randomUUID(), constantName, type, value, null);
            constants.add(c);
            return c.id();
        }

        /** Places an operator whose connectors are a snapshot of {@code target}'s interface. */
        public Operator operator(TransformationRevision target) {
            Operator op = new Operator(UUID.randomUUID(), target.id(), target.name(),
                    target.ioInterface().inputs(), target.ioInterface().outputs(), null);
            operators.add(op);
            return op;
        }

        public WorkflowBuilder operator(Operator op) {
            operators.add(op);
            return this;
        }

        public WorkflowBuilder link(LinkEndpoint start, LinkEndpoint end) {
            links.add(new Link(UUID.randomUUID(), start, end));
            return this;
        }

        public static LinkEndpoint in(Operator op, String connectorName) {
            return LinkEndpoint.operator(op.id(), op.inputs().stream()
                    .filter(c -> c.name().equals(connectorName)).findFirst().orElseThrow().id());
        }

        public static LinkEndpoint out(Operator op, String connectorName) {
            return LinkEndpoint.operator(op.id(), op.outputs().stream()
                    .filter(c -> c.name().equals(connectorName)).findFirst().orElseThrow().id());
        }

        public TransformationRevision build() {
            WorkflowGraph graph = new WorkflowGraph(inputs, outputs, constants, operators, links);
            return new TransformationRevision(id, revisionGroupId, name, null, "Test", null, versionTag,
                    TransformationType.WORKFLOW, state, null, null, new IoInterface(inputs, outputs),
                    null, graph, testWiring);
        }
    }
}
