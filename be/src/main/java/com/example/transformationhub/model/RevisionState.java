package com.example.transformationhub.model;

/**
 * Lifecycle state of a transformation revision.
 * <pre>
 * DRAFT ──► RELEASED ──► DISABLED
 *   ▲  │
 *   └──┘ (edits)
 * </pre>
 * DISABLED is terminal.
 */
public enum RevisionState {
    DRAFT,
    RELEASED,
    DISABLED
}
