package com.phillippitts.modelrelay.exception;

/**
 * Base exception for all model relay errors.
 * Domain exceptions extend this class so callers can catch relay failures in one place.
 */
public class ModelRelayException extends RuntimeException {

    public ModelRelayException(String message) {
        super(message);
    }

    public ModelRelayException(String message, Throwable cause) {
        super(message, cause);
    }

    public ModelRelayException(Throwable cause) {
        super(cause);
    }
}
