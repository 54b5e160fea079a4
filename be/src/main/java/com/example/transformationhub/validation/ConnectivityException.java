package com.example.transformationhub.validation;

import lombok.Getter;

/**
 * A required connector without an incoming link, a destination with several, or a link whose
 * endpoint does not exist or points the wrong way.
 */
@Getter
public class ConnectivityException extends WorkflowGraphValidationException {

    private final String connector;

    public ConnectivityException(String connector, String message) {
        super("links[" + connector + "]", message);
        this.connector = connector;
    }
}
