package com.phillippitts.modelrelay.exception;

/**
 * Thrown when a request id is not (or no longer) present in the task registry.
 */
public class RequestNotFoundException extends ModelRelayException {

    private final long requestId;

    public RequestNotFoundException(long requestId) {
        super("Request not found: " + requestId);
        this.requestId = requestId;
    }

    public long getRequestId() {
        return requestId;
    }
}
