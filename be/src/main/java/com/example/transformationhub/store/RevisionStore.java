package com.example.transformationhub.store;

import com.example.transformationhub.model.NestingRow;
import com.example.transformationhub.model.TransformationRevision;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD contract over persisted transformation revisions and their derived nesting rows.
 * <p>
 * The core only reads and writes through this interface. Implementations must make one revision
 * write and its nesting replacement visible together when called inside one transaction.
 * </p>
 */
public interface RevisionStore {

    Optional<TransformationRevision> get(UUID id);

    Optional<TransformationRevision> getByGroupAndTag(UUID revisionGroupId, String versionTag);

    List<TransformationRevision> findAll();

    /** Inserts or overwrites by id. */
    void put(TransformationRevision revision);

    void delete(UUID id);

    /** Rows of {@code workflowId}, ordered by {@link NestingRow#ORDER}. */
    List<NestingRow> listNesting(UUID workflowId);

    /** Rows of any workflow that reach {@code descendantId}. */
    List<NestingRow> listNestingByDescendant(UUID descendantId);

    void replaceNesting(UUID workflowId, List<NestingRow> rows);

    void deleteNesting(UUID workflowId);
}
