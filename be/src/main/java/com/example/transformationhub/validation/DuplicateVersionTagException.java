package com.example.transformationhub.validation;

import lombok.Getter;

import java.util.UUID;

@Getter
public class DuplicateVersionTagException extends WorkflowGraphValidationException {

    private final UUID existingId;

    public DuplicateVersionTagException(UUID revisionGroupId, String versionTag, UUID existingId) {
        super("versionTag", "version tag '" + versionTag + "' is already used in revision group "
                + revisionGroupId + " by " + existingId);
        this.existingId = existingId;
    }
}
