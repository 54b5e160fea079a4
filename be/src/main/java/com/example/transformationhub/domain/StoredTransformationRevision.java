package com.example.transformationhub.domain;

import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for a persisted transformation revision.
 * <p>
 * The full revision is kept as JSON in {@code revision_json}; the columns next to it are copies
 * used for lookups and listing. {@code (revision_group_id, version_tag)} is unique.
 * </p>
 */
@Entity
@Table(name = "transformation_revision",
        uniqueConstraints = @UniqueConstraint(columnNames = {"revision_group_id", "version_tag"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StoredTransformationRevision {

    @Id
    private UUID id;

    @Column(name = "revision_group_id", nullable = false)
    private UUID revisionGroupId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "version_tag", nullable = false, length = 255)
    private String versionTag;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransformationType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RevisionState state;

    @Column(name = "revision_json", nullable = false, columnDefinition = "CLOB")
    private String revisionJson;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public StoredTransformationRevision(UUID id, UUID revisionGroupId, String name, String versionTag,
                                        TransformationType type, RevisionState state, String revisionJson,
                                        Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.revisionGroupId = Objects.requireNonNull(revisionGroupId, "revisionGroupId");
        this.name = Objects.requireNonNull(name, "name");
        this.versionTag = Objects.requireNonNull(versionTag, "versionTag");
        this.type = Objects.requireNonNull(type, "type");
        this.state = Objects.requireNonNull(state, "state");
        this.revisionJson = Objects.requireNonNull(revisionJson, "revisionJson");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
