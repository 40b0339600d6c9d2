package com.phillippitts.modelrelay.exception;

/**
 * Thrown when a multi-provider operation is invoked without any candidate providers.
 */
public class NoProvidersException extends ModelRelayException {

    public NoProvidersException(String operation) {
        super("No providers supplied for " + operation);
    }
}
