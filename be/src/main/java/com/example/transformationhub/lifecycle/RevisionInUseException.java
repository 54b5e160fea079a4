package com.example.transformationhub.lifecycle;

import com.example.transformationhub.error.CoreException;

import lombok.Getter;

import java.util.Set;
import java.util.UUID;

/**
 * The revision is still used by stored workflows that are not disabled.
 */
@Getter
public class RevisionInUseException extends CoreException {

    private final UUID revisionId;
    private final Set<UUID> usedBy;

    public RevisionInUseException(UUID revisionId, Set<UUID> usedBy, String action) {
        super("Cannot " + action + " transformation revision " + revisionId + ": used by workflows " + usedBy);
        this.revisionId = revisionId;
        this.usedBy = Set.copyOf(usedBy);
    }
}
