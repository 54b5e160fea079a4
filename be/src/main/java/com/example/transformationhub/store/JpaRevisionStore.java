package com.example.transformationhub.store;

import com.example.transformationhub.domain.StoredNesting;
import com.example.transformationhub.domain.StoredTransformationRevision;
import com.example.transformationhub.model.NestingRow;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.repository.StoredNestingRepository;
import com.example.transformationhub.repository.StoredTransformationRevisionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link RevisionStore} backed by Spring Data JPA. Revisions are stored as JSON documents,
 * nesting rows as one table row each.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaRevisionStore implements RevisionStore {

    private final StoredTransformationRevisionRepository revisions;
    private final StoredNestingRepository nesting;
    private final JsonMapper jsonMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<TransformationRevision> get(UUID id) {
        return revisions.findById(id).map(this::toRevision);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TransformationRevision> getByGroupAndTag(UUID revisionGroupId, String versionTag) {
        return revisions.findByRevisionGroupIdAndVersionTag(revisionGroupId, versionTag).map(this::toRevision);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TransformationRevision> findAll() {
        return revisions.findAll().stream().map(this::toRevision).toList();
    }

    @Override
    @Transactional
    public void put(TransformationRevision revision) {
        StoredTransformationRevision entity = new StoredTransformationRevision(
                revision.id(),
                revision.revisionGroupId(),
                revision.name(),
                revision.versionTag(),
                revision.type(),
                revision.state(),
                writeRevision(revision),
                clock.instant()
        );
        revisions.save(entity);
        log.debug("Stored revision id={} state={}", revision.id(), revision.state());
    }

    @Override
    @Transactional
    public void delete(UUID id) {
        revisions.deleteById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<NestingRow> listNesting(UUID workflowId) {
        return nesting.findByWorkflowId(workflowId).stream()
                .map(JpaRevisionStore::toRow)
                .sorted(NestingRow.ORDER)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<NestingRow> listNestingByDescendant(UUID descendantId) {
        return nesting.findByDescendantId(descendantId).stream()
                .map(JpaRevisionStore::toRow)
                .toList();
    }

    @Override
    @Transactional
    public void replaceNesting(UUID workflowId, List<NestingRow> rows) {
        nesting.deleteByWorkflowId(workflowId);
        nesting.saveAll(rows.stream()
                .map(row -> new StoredNesting(row.workflowId(), row.descendantId(), row.pathKey(), row.depth()))
                .toList());
        log.debug("Replaced nesting workflowId={} rows={}", workflowId, rows.size());
    }

    @Override
    @Transactional
    public void deleteNesting(UUID workflowId) {
        nesting.deleteByWorkflowId(workflowId);
    }

    private static NestingRow toRow(StoredNesting entity) {
        List<UUID> path = Arrays.stream(entity.getViaOperatorPath().split("/"))
                .map(UUID::fromString)
                .toList();
        return new NestingRow(entity.getWorkflowId(), entity.getDescendantId(), path, entity.getDepth());
    }

    private TransformationRevision toRevision(StoredTransformationRevision entity) {
        try {
            return jsonMapper.readValue(entity.getRevisionJson(), TransformationRevision.class);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize transformation revision " + entity.getId(), e);
        }
    }

    private String writeRevision(TransformationRevision revision) {
        try {
            return jsonMapper.writeValueAsString(revision);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize transformation revision " + revision.id(), e);
        }
    }
}
