package com.example.transformationhub.support;

import com.example.transformationhub.model.NestingRow;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.store.RevisionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link RevisionStore} for core tests.
 * <p>
 * No transactions: a write is visible as soon as it is made. Callers rely on the service
 * validating before it writes.
 * </p>
 */
public class InMemoryRevisionStore implements RevisionStore {

    private final ConcurrentHashMap<UUID, TransformationRevision> revisions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, List<NestingRow>> nesting = new ConcurrentHashMap<>();

    @Override
    public Optional<TransformationRevision> get(UUID id) {
        return Optional.ofNullable(revisions.get(id));
    }

    @Override
    public Optional<TransformationRevision> getByGroupAndTag(UUID revisionGroupId, String versionTag) {
        return revisions.values().stream()
                .filter(r -> r.revisionGroupId().equals(revisionGroupId) && r.versionTag().equals(versionTag))
                .findFirst();
    }

    @Override
    public List<TransformationRevision> findAll() {
        return List.copyOf(revisions.values());
    }

    @Override
    public void put(TransformationRevision revision) {
        revisions.put(revision.id(), revision);
    }

    @Override
    public void delete(UUID id) {
        revisions.remove(id);
    }

    @Override
    public List<NestingRow> listNesting(UUID workflowId) {
        List<NestingRow> rows = new ArrayList<>(nesting.getOrDefault(workflowId, List.of()));
        rows.sort(NestingRow.ORDER);
        return rows;
    }

    @Override
    public List<NestingRow> listNestingByDescendant(UUID descendantId) {
        return nesting.values().stream()
                .flatMap(List::stream)
                .filter(row -> row.descendantId().equals(descendantId))
                .toList();
    }

    @Override
    public void replaceNesting(UUID workflowId, List<NestingRow> rows) {
        if (rows.isEmpty()) {
            nesting.remove(workflowId);
        } else {
            nesting.put(workflowId, List.copyOf(rows));
        }
    }

    @Override
    public void deleteNesting(UUID workflowId) {
        nesting.remove(workflowId);
    }

    /** Stores a revision and its rows without any checks, as a test precondition. */
    public void seed(TransformationRevision revision, List<NestingRow> rows) {
        put(revision);
        replaceNesting(revision.id(), rows);
    }

    public int size() {
        return revisions.size();
    }

    public int nestingRowCount() {
        return nesting.values().stream().mapToInt(List::size).sum();
    }
}
