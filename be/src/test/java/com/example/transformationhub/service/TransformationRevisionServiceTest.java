package com.example.transformationhub.service;

import com.example.transformationhub.api.TransformationNotFoundException;
import com.example.transformationhub.codegen.ConcurrentRevisionModificationException;
import com.example.transformationhub.codegen.ExecutableUnit;
import com.example.transformationhub.codegen.WorkflowCodeGenerator;
import com.example.transformationhub.lifecycle.ImmutableRevisionException;
import com.example.transformationhub.lifecycle.InvalidTransitionException;
import com.example.transformationhub.lifecycle.RevisionInUseException;
import com.example.transformationhub.model.DataType;
import com.example.transformationhub.model.LinkEndpoint;
import com.example.transformationhub.model.NestingRow;
import com.example.transformationhub.model.Operator;
import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.model.TransformationType;
import com.example.transformationhub.nesting.NestingResolver;
import com.example.transformationhub.support.InMemoryRevisionStore;
import com.example.transformationhub.support.Revisions;
import com.example.transformationhub.support.Revisions.WorkflowBuilder;
import com.example.transformationhub.validation.DuplicateVersionTagException;
import com.example.transformationhub.validation.TypeMismatchException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.example.transformationhub.support.Revisions.WorkflowBuilder.in;
import static com.example.transformationhub.support.Revisions.WorkflowBuilder.out;
import static com.example.transformationhub.support.Revisions.connector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TransformationRevisionService")
class TransformationRevisionServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-04T10:15:30Z");

    private InMemoryRevisionStore store;
    private TransformationRevisionService service;
    private TransformationRevision component;

    @BeforeEach
    void setUp() {
        store = new InMemoryRevisionStore();
        service = newService(store);
        component = Revisions.passThrough("C");
    }

    private static TransformationRevisionService newService(InMemoryRevisionStore store) {
        return new TransformationRevisionService(store, new NestingResolver(store, 64),
                new WorkflowCodeGenerator(store), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static TransformationRevision withState(TransformationRevision revision, RevisionState state) {
        return revision.withState(state, revision.releasedTimestamp(), revision.disabledTimestamp());
    }

    @Nested
    @DisplayName("end-to-end scenarios")
    class Scenarios {

        @Test
        @DisplayName("storing a draft workflow over a draft component yields exactly one nesting row")
        void scenarioB() {
            service.validateAndStore(component, false);
            TransformationRevision wf = Revisions.wrapping("WF", component).build();
            service.validateAndStore(wf, false);
            UUID op = wf.graph().operators().get(0).id();

            assertThat(service.nesting(wf.id()))
                    .containsExactly(new NestingRow(wf.id(), component.id(), List.of(op), 1));
        }

        @Test
        @DisplayName("a used component cannot be deleted until the released workflow is disabled")
        void scenarioC() {
            service.validateAndStore(component, false);
            TransformationRevision wf = Revisions.wrapping("WF", component).build();
            service.validateAndStore(wf, false);

            TransformationRevision released = service.validateAndStore(withState(wf, RevisionState.RELEASED), false);
            assertThat(released.releasedTimestamp()).isEqualTo(NOW);

            assertThatThrownBy(() -> service.delete(component.id()))
                    .isInstanceOf(RevisionInUseException.class)
                    .satisfies(ex -> assertThat(((RevisionInUseException) ex).getUsedBy()).containsExactly(wf.id()));
            assertThat(store.get(component.id())).isPresent();

            service.validateAndStore(withState(released, RevisionState.DISABLED), false);
            service.delete(component.id());

            assertThat(store.get(component.id())).isEmpty();
            assertThat(service.findById(wf.id()).state()).isEqualTo(RevisionState.DISABLED);
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        @DisplayName("create rejects an existing id")
        void createRejectsExisting() {
            service.create(component);

            assertThatThrownBy(() -> service.create(component)).isInstanceOf(TransformationAlreadyExistsException.class);
        }

        @Test
        @DisplayName("rejects a second revision with the same group and version tag")
        void duplicateVersionTag() {
            service.validateAndStore(component, false);
            TransformationRevision sameTag = new TransformationRevision(UUID.randomUUID(), component.revisionGroupId(),
                    "C2", null, null, null, component.versionTag(), TransformationType.COMPONENT, RevisionState.DRAFT,
                    null, null, component.ioInterface(), "pass", null, null);

            assertThatThrownBy(() -> service.validateAndStore(sameTag, false))
                    .isInstanceOf(DuplicateVersionTagException.class);
        }

        @Test
        @DisplayName("a rejected write leaves revisions and nesting rows untouched")
        void noPartialWrites() {
            TransformationRevision adder = Revisions.component("add",
                    List.of(connector("a", DataType.INT)), List.of(connector("sum", DataType.INT)));
            service.validateAndStore(component, false);
            service.validateAndStore(adder, false);
            TransformationRevision wf = Revisions.wrapping("WF", component).build();
            service.validateAndStore(wf, false);
            int revisions = store.size();
            int rows = store.nestingRowCount();

            WorkflowBuilder broken = Revisions.workflow("broken").id(wf.id()).revisionGroupId(wf.revisionGroupId());
            UUID x = broken.input("x", DataType.STRING);
            UUID y = broken.output("y", DataType.INT);
            Operator op = broken.operator(adder);
            broken.link(LinkEndpoint.workflow(x), in(op, "a")).link(out(op, "sum"), LinkEndpoint.workflow(y));

            assertThatThrownBy(() -> service.validateAndStore(broken.build(), false))
                    .isInstanceOf(TypeMismatchException.class);
            assertThat(store.size()).isEqualTo(revisions);
            assertThat(store.nestingRowCount()).isEqualTo(rows);
            assertThat(store.get(wf.id())).contains(wf);
        }

        @Test
        @DisplayName("overwriting a released revision needs the flag and keeps releasedTimestamp")
        void releasedOverwrite() {
            TransformationRevision released = service.validateAndStore(withState(component, RevisionState.RELEASED), false);
            TransformationRevision changed = new TransformationRevision(component.id(), component.revisionGroupId(),
                    "C renamed", null, null, null, component.versionTag(), TransformationType.COMPONENT,
                    RevisionState.RELEASED, null, null, component.ioInterface(), "changed", null, null);

            assertThatThrownBy(() -> service.validateAndStore(changed, false))
                    .isInstanceOf(ImmutableRevisionException.class);

            TransformationRevision stored = service.validateAndStore(changed, true);
            assertThat(stored.name()).isEqualTo("C renamed");
            assertThat(stored.releasedTimestamp()).isEqualTo(released.releasedTimestamp());
        }

        @Test
        @DisplayName("a released workflow in use may not change the revisions it references")
        void referencesFrozenWhileInUse() {
            TransformationRevision other = Revisions.passThrough("other");
            service.validateAndStore(component, false);
            service.validateAndStore(other, false);
            TransformationRevision inner = service.validateAndStore(
                    Revisions.wrapping("inner", component).state(RevisionState.RELEASED).build(), false);
            service.validateAndStore(Revisions.wrapping("outer", inner).build(), false);

            TransformationRevision rewired = Revisions.wrapping("inner", other)
                    .id(inner.id())
                    .revisionGroupId(inner.revisionGroupId())
                    .state(RevisionState.RELEASED)
                    .build();

            assertThatThrownBy(() -> service.validateAndStore(rewired, true))
                    .isInstanceOf(RevisionInUseException.class);
            assertThat(service.nesting(inner.id())).extracting(NestingRow::descendantId).containsExactly(component.id());
        }

        @Test
        @DisplayName("nothing leaves DISABLED")
        void disabledIsTerminal() {
            TransformationRevision released = service.validateAndStore(withState(component, RevisionState.RELEASED), false);
            TransformationRevision disabled = service.validateAndStore(withState(released, RevisionState.DISABLED), false);

            assertThat(disabled.disabledTimestamp()).isEqualTo(NOW);
            assertThatThrownBy(() -> service.validateAndStore(withState(disabled, RevisionState.RELEASED), true))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("deletion")
    class Deletion {

        @Test
        @DisplayName("deleting an unreferenced workflow removes its nesting rows")
        void deleteRemovesRows() {
            service.validateAndStore(component, false);
            TransformationRevision wf = Revisions.wrapping("WF", component).build();
            service.validateAndStore(wf, false);

            service.delete(wf.id());

            assertThat(store.nestingRowCount()).isZero();
            assertThat(service.findAll(null, null)).extracting(TransformationRevision::id).containsExactly(component.id());
        }

        @Test
        @DisplayName("fails for an unknown id")
        void deleteUnknown() {
            assertThatThrownBy(() -> service.checkDeletable(UUID.randomUUID()))
                    .isInstanceOf(TransformationNotFoundException.class)
                    .hasMessageContaining("Found no transformation revision");
        }
    }

    @Nested
    @DisplayName("compileForExecution")
    class CompileForExecution {

        @Test
        @DisplayName("compiles a stored workflow")
        void compiles() {
            service.validateAndStore(component, false);
            TransformationRevision wf = Revisions.wrapping("WF", component).build();
            service.validateAndStore(wf, false);

            ExecutableUnit unit = service.compileForExecution(wf.id());

            assertThat(unit.transformationId()).isEqualTo(wf.id());
            assertThat(unit.steps()).hasSize(1);
        }

        @Test
        @DisplayName("fails retryably when a dependency changes during compilation")
        void concurrentModification() {
            TransformationRevision changed = new TransformationRevision(component.id(), component.revisionGroupId(),
                    component.name(), "edited meanwhile", null, null, component.versionTag(), component.type(),
                    component.state(), null, null, component.ioInterface(), component.code(), null, null);
            InMemoryRevisionStore racing = new InMemoryRevisionStore() {
                private boolean edited;

                @Override
                public Optional<TransformationRevision> get(UUID id) {
                    Optional<TransformationRevision> result = super.get(id);
                    if (id.equals(component.id()) && !edited && result.isPresent()) {
                        edited = true;
                        put(changed);
                    }
                    return result;
                }
            };
            TransformationRevision wf = Revisions.wrapping("WF", component).build();
            racing.seed(component, List.of());
            racing.seed(wf, List.of());

            assertThatThrownBy(() -> newService(racing).compileForExecution(wf.id()))
                    .isInstanceOf(ConcurrentRevisionModificationException.class)
                    .satisfies(ex -> assertThat(((ConcurrentRevisionModificationException) ex).isRetryable()).isTrue());
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("findAll filters by type and state")
        void filters() {
            service.validateAndStore(component, false);
            TransformationRevision wf = Revisions.wrapping("WF", component).build();
            service.validateAndStore(wf, false);

            assertThat(service.findAll(TransformationType.WORKFLOW, null)).extracting(TransformationRevision::id)
                    .containsExactly(wf.id());
            assertThat(service.findAll(null, RevisionState.RELEASED)).isEmpty();
            assertThat(service.usedBy(component.id())).containsExactly(wf.id());
        }
    }
}
