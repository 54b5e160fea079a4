package com.example.transformationhub.service;

import com.example.transformationhub.api.TransformationNotFoundException;
import com.example.transformationhub.codegen.CompilationResult;
import com.example.transformationhub.codegen.ConcurrentRevisionModificationException;
import com.example.transformationhub.codegen.ExecutableUnit;
import com.example.transformationhub.codegen.WorkflowCodeGenerator;
import com.example.transformationhub.lifecycle.RevisionInUseException;
import com.example.transformationhub.lifecycle.RevisionLifecycle;
import com.example.transformationhub.model.NestingRow;
import com.example.transformationhub.model.Operator;
import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.model.TransformationType;
import com.example.transformationhub.nesting.NestingResolver;
import com.example.transformationhub.store.RevisionStore;
import com.example.transformationhub.validation.DuplicateVersionTagException;
import com.example.transformationhub.validation.WorkflowGraphValidator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Application service for transformation revisions: the only write path into the store.
 * <p>
 * Every write runs lifecycle checks, validation and nesting recomputation inside one transaction,
 * so a rejected write leaves no trace. Compilation reads outside a transaction and re-checks
 * every revision it read before returning.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransformationRevisionService {

    private final RevisionStore store;
    private final NestingResolver nestingResolver;
    private final WorkflowCodeGenerator codeGenerator;
    private final Clock clock;

    /**
     * Creates the revision, or replaces the stored one with the same id.
     *
     * @return the revision as stored, timestamps included
     */
    @Transactional
    public TransformationRevision validateAndStore(TransformationRevision revision, boolean allowOverwriteReleased) {
        log.debug("Validating revision id={} type={} state={}", revision.id(), revision.type(), revision.state());
        TransformationRevision current = store.get(revision.id()).orElse(null);
        TransformationRevision toStore = RevisionLifecycle.prepareWrite(current, revision, allowOverwriteReleased,
                clock.instant());

        if (current != null && current.state() == RevisionState.RELEASED && toStore.state() == RevisionState.DISABLED) {
            store.put(toStore);
            log.info("Disabled transformation revision id={} name={}", toStore.id(), toStore.name());
            return toStore;
        }

        checkVersionTag(toStore);
        WorkflowGraphValidator.validate(toStore, store);
        if (current != null && current.state() == RevisionState.RELEASED) {
            checkReferencesUnchanged(current, toStore);
        }
        List<NestingRow> rows = nestingResolver.recompute(toStore);
        store.put(toStore);
        store.replaceNesting(toStore.id(), rows);
        log.info("Stored transformation revision id={} name={} type={} state={}",
                toStore.id(), toStore.name(), toStore.type(), toStore.state());
        return toStore;
    }

    /**
     * Stores a revision that does not exist yet.
     *
     * @throws TransformationAlreadyExistsException if the id is taken
     */
    @Transactional
    public TransformationRevision create(TransformationRevision revision) {
        if (store.get(revision.id()).isPresent()) {
            throw new TransformationAlreadyExistsException(revision.id());
        }
        return validateAndStore(revision, false);
    }

    /**
     * Compiles the stored revision. Fails with a retryable error if any revision read during
     * compilation changed before the unit is returned.
     */
    public ExecutableUnit compileForExecution(UUID id) {
        TransformationRevision revision = findById(id);
        CompilationResult result = codeGenerator.compileTracked(revision);
        for (Map.Entry<UUID, TransformationRevision> read : result.readRevisions().entrySet()) {
            Optional<TransformationRevision> latest = store.get(read.getKey());
            if (latest.isEmpty() || !latest.get().equals(read.getValue())) {
                log.warn("Revision changed during compilation id={} root={}", read.getKey(), id);
                throw new ConcurrentRevisionModificationException(read.getKey());
            }
        }
        log.info("Compiled transformation revision id={} steps={}", id,
                result.unit().steps() != null ? result.unit().steps().size() : 0);
        return result.unit();
    }

    /**
     * @throws TransformationNotFoundException if nothing is stored under {@code id}
     * @throws RevisionInUseException if a workflow that is not disabled still uses it
     */
    @Transactional(readOnly = true)
    public void checkDeletable(UUID id) {
        findById(id);
        Set<UUID> users = nestingResolver.activeUsers(id);
        if (!users.isEmpty()) {
            throw new RevisionInUseException(id, users, "delete");
        }
    }

    @Transactional
    public void delete(UUID id) {
        log.debug("Deleting revision id={}", id);
        checkDeletable(id);
        store.deleteNesting(id);
        store.delete(id);
        log.info("Deleted transformation revision id={}", id);
    }

    @Transactional(readOnly = true)
    public TransformationRevision findById(UUID id) {
        return store.get(id).orElseThrow(() -> new TransformationNotFoundException(id));
    }

    /** All stored revisions, optionally filtered; {@code null} means no filter. */
    @Transactional(readOnly = true)
    public List<TransformationRevision> findAll(TransformationType type, RevisionState state) {
        List<TransformationRevision> list = store.findAll().stream()
                .filter(r -> type == null || r.type() == type)
                .filter(r -> state == null || r.state() == state)
                .sorted(Comparator.comparing(TransformationRevision::name)
                        .thenComparing(TransformationRevision::versionTag)
                        .thenComparing(TransformationRevision::id))
                .toList();
        log.debug("findAll type={} state={} returned {} revisions", type, state, list.size());
        return list;
    }

    @Transactional(readOnly = true)
    public List<NestingRow> nesting(UUID id) {
        findById(id);
        return store.listNesting(id);
    }

    @Transactional(readOnly = true)
    public Set<UUID> usedBy(UUID id) {
        findById(id);
        return nestingResolver.usedBy(id);
    }

    private void checkVersionTag(TransformationRevision revision) {
        store.getByGroupAndTag(revision.revisionGroupId(), revision.versionTag())
                .filter(existing -> !existing.id().equals(revision.id()))
                .ifPresent(existing -> {
                    throw new DuplicateVersionTagException(revision.revisionGroupId(), revision.versionTag(),
                            existing.id());
                });
    }

    /** An overwritten released revision that is still in use keeps the revisions it references. */
    private void checkReferencesUnchanged(TransformationRevision current, TransformationRevision replacement) {
        if (referencedIds(current).equals(referencedIds(replacement))) {
            return;
        }
        Set<UUID> users = nestingResolver.activeUsers(current.id());
        if (!users.isEmpty()) {
            throw new RevisionInUseException(current.id(), users, "change the references of");
        }
    }

    private static List<UUID> referencedIds(TransformationRevision revision) {
        if (revision.graph() == null) {
            return List.of();
        }
        return revision.graph().operators().stream()
                .map(Operator::transformationId)
                .sorted()
                .toList();
    }
}
