package com.example.transformationhub.lifecycle;

import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;

import java.time.Instant;
import java.util.Objects;

/**
 * State machine guarding writes to transformation revisions.
 *
 * <p><strong>Allowed writes:</strong></p>
 * <ul>
 *   <li>new revision → any state (imports keep their state)</li>
 *   <li>DRAFT → DRAFT, DRAFT → RELEASED</li>
 *   <li>RELEASED → RELEASED only with {@code allowOverwriteReleased}</li>
 *   <li>RELEASED → DISABLED</li>
 * </ul>
 * Nothing leaves DISABLED.
 */
public final class RevisionLifecycle {

    private RevisionLifecycle() {
    }

    /**
     * @param current stored state, {@code null} for a revision that does not exist yet
     * @throws ImmutableRevisionException  RELEASED → RELEASED without the overwrite flag
     * @throws InvalidTransitionException  any transition not listed above
     */
    public static void authorizeWrite(RevisionState current, RevisionState requested, boolean allowOverwriteReleased) {
        Objects.requireNonNull(requested, "requested");
        if (current == null) {
            return;
        }
        if (current == RevisionState.RELEASED && requested == RevisionState.RELEASED) {
            if (!allowOverwriteReleased) {
                throw new ImmutableRevisionException();
            }
            return;
        }
        boolean valid = switch (current) {
            case DRAFT -> requested == RevisionState.DRAFT || requested == RevisionState.RELEASED;
            case RELEASED -> requested == RevisionState.DISABLED;
            case DISABLED -> false;
        };
        if (!valid) {
            throw new InvalidTransitionException(current, requested);
        }
    }

    /**
     * Authorizes the write and returns the revision to persist, with timestamps stamped.
     * <p>
     * Disabling keeps the stored content: only state and {@code disabledTimestamp} change.
     * An overwrite of a released revision keeps its {@code releasedTimestamp}.
     * </p>
     *
     * @param current stored revision, {@code null} when creating
     */
    public static TransformationRevision prepareWrite(TransformationRevision current, TransformationRevision submitted,
                                                      boolean allowOverwriteReleased, Instant now) {
        RevisionState requested = submitted.state();
        if (current == null) {
            Instant released = requested == RevisionState.DRAFT ? null : orNow(submitted.releasedTimestamp(), now);
            Instant disabled = requested == RevisionState.DISABLED ? orNow(submitted.disabledTimestamp(), now) : null;
            return submitted.withState(requested, released, disabled);
        }
        authorizeWrite(current.state(), requested, allowOverwriteReleased);
        return switch (current.state()) {
            case DRAFT -> requested == RevisionState.RELEASED
                    ? submitted.withState(RevisionState.RELEASED, now, null)
                    : submitted.withState(RevisionState.DRAFT, null, null);
            case RELEASED -> requested == RevisionState.RELEASED
                    ? submitted.withState(RevisionState.RELEASED, current.releasedTimestamp(), null)
                    : current.withState(RevisionState.DISABLED, current.releasedTimestamp(), now);
            case DISABLED -> throw new InvalidTransitionException(current.state(), requested);
        };
    }

    private static Instant orNow(Instant value, Instant now) {
        return value != null ? value : now;
    }
}
