package com.example.transformationhub.api.v1.dto;

import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.model.TransformationType;

import java.time.Instant;
import java.util.UUID;

/**
 * Transformation list item: identity, type and lifecycle state without code or graph.
 */
public record TransformationListItem(
        UUID id,
        UUID revisionGroupId,
        String name,
        String category,
        String versionTag,
        TransformationType type,
        RevisionState state,
        Instant releasedTimestamp,
        Instant disabledTimestamp
) {
    public static TransformationListItem of(TransformationRevision revision) {
        return new TransformationListItem(revision.id(), revision.revisionGroupId(), revision.name(),
                revision.category(), revision.versionTag(), revision.type(), revision.state(),
                revision.releasedTimestamp(), revision.disabledTimestamp());
    }
}
