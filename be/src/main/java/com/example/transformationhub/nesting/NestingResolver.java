package com.example.transformationhub.nesting;

import com.example.transformationhub.api.TransformationNotFoundException;
import com.example.transformationhub.model.NestingRow;
import com.example.transformationhub.model.Operator;
import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.store.RevisionStore;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Computes which revisions a workflow uses, directly or through nested workflows.
 * <p>
 * Rows are built from one level of operators plus the already stored rows of each referenced
 * revision, so a workflow's rows are only as fresh as its children's were when it was written.
 * </p>
 */
@Slf4j
public class NestingResolver {

    private final RevisionStore store;
    private final int maxDepth;

    public NestingResolver(RevisionStore store, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.store = store;
        this.maxDepth = maxDepth;
    }

    /**
     * Recomputes the rows of a stored workflow.
     *
     * @throws TransformationNotFoundException if no revision has this id
     */
    public List<NestingRow> recompute(UUID workflowId) {
        TransformationRevision workflow = store.get(workflowId)
                .orElseThrow(() -> new TransformationNotFoundException(workflowId));
        return recompute(workflow);
    }

    /**
     * Rows for {@code revision} as it would be stored. Components have none.
     * The result is sorted by {@link NestingRow#ORDER}; recomputing unchanged input yields an equal list.
     *
     * @throws UnboundedNestingException if stored rows show the workflow inside itself or nested beyond the limit
     */
    public List<NestingRow> recompute(TransformationRevision revision) {
        return switch (revision.type()) {
            case COMPONENT -> List.of();
            case WORKFLOW -> recomputeWorkflow(revision);
        };
    }

    private List<NestingRow> recomputeWorkflow(TransformationRevision workflow) {
        UUID workflowId = workflow.id();
        TreeSet<NestingRow> rows = new TreeSet<>(NestingRow.ORDER);
        for (Operator op : workflow.graph().operators()) {
            UUID target = op.transformationId();
            if (target.equals(workflowId)) {
                throw defect(workflowId, "operator " + op.id() + " references the workflow itself");
            }
            rows.add(new NestingRow(workflowId, target, List.of(op.id()), 1));
            for (NestingRow child : store.listNesting(target)) {
                if (child.descendantId().equals(workflowId)) {
                    throw defect(workflowId, "revision " + target + " already contains it via " + child.pathKey());
                }
                if (child.depth() + 1 > maxDepth) {
                    throw defect(workflowId, "depth " + (child.depth() + 1) + " exceeds " + maxDepth);
                }
                List<UUID> path = new ArrayList<>(child.depth() + 1);
                path.add(op.id());
                path.addAll(child.viaOperatorPath());
                rows.add(new NestingRow(workflowId, child.descendantId(), path, child.depth() + 1));
            }
        }
        log.debug("Recomputed nesting workflowId={} rows={}", workflowId, rows.size());
        return List.copyOf(rows);
    }

    private UnboundedNestingException defect(UUID workflowId, String message) {
        log.error("Nesting data inconsistent for workflowId={}: {}", workflowId, message);
        return new UnboundedNestingException(workflowId, message);
    }

    /** Workflows whose stored rows reach {@code revisionId}. */
    public Set<UUID> usedBy(UUID revisionId) {
        Set<UUID> workflows = new LinkedHashSet<>();
        for (NestingRow row : store.listNestingByDescendant(revisionId)) {
            workflows.add(row.workflowId());
        }
        return workflows;
    }

    /** {@link #usedBy(UUID)} without disabled workflows, which no longer hold on to what they use. */
    public Set<UUID> activeUsers(UUID revisionId) {
        Set<UUID> active = new LinkedHashSet<>();
        for (UUID workflowId : usedBy(revisionId)) {
            store.get(workflowId)
                    .filter(wf -> wf.state() != RevisionState.DISABLED)
                    .ifPresent(wf -> active.add(wf.id()));
        }
        return active;
    }
}
