package com.example.transformationhub.codegen;

import com.example.transformationhub.error.CoreException;

import lombok.Getter;

import java.util.UUID;

/**
 * A revision read during compilation changed before the compiled unit was returned.
 */
@Getter
public class ConcurrentRevisionModificationException extends CoreException {

    private final UUID revisionId;

    public ConcurrentRevisionModificationException(UUID revisionId) {
        super("Transformation revision " + revisionId + " was modified during compilation; re-read and retry");
        this.revisionId = revisionId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
