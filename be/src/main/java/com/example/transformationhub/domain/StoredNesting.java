package com.example.transformationhub.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Objects;
import java.util.UUID;

/**
 * One persisted nesting row. {@code via_operator_path} holds the operator ids joined by {@code /}.
 */
@Entity
@Table(name = "nesting", indexes = {
        @Index(name = "idx_nesting_workflow", columnList = "workflow_id"),
        @Index(name = "idx_nesting_descendant", columnList = "descendant_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StoredNesting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "descendant_id", nullable = false)
    private UUID descendantId;

    @Column(name = "via_operator_path", nullable = false, length = 4096)
    private String viaOperatorPath;

    @Column(nullable = false)
    private int depth;

    public StoredNesting(UUID workflowId, UUID descendantId, String viaOperatorPath, int depth) {
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
        this.descendantId = Objects.requireNonNull(descendantId, "descendantId");
        this.viaOperatorPath = Objects.requireNonNull(viaOperatorPath, "viaOperatorPath");
        this.depth = depth;
    }
}
