package com.example.transformationhub.validation;

import com.example.transformationhub.model.DataType;

import lombok.Getter;

import java.util.UUID;

@Getter
public class TypeMismatchException extends WorkflowGraphValidationException {

    private final UUID linkId;
    private final DataType expected;
    private final DataType actual;

    public TypeMismatchException(UUID linkId, DataType expected, DataType actual) {
        super("links[" + linkId + "]", "destination expects " + expected + " but source provides " + actual);
        this.linkId = linkId;
        this.expected = expected;
        this.actual = actual;
    }
}
