package com.phillippitts.modelrelay.exception;

/**
 * Thrown when a bounded wait for a request elapses before the request is terminal.
 */
public class RequestTimeoutException extends ModelRelayException {

    private final long requestId;
    private final long timeoutMs;

    public RequestTimeoutException(long requestId, long timeoutMs) {
        super("Request " + requestId + " not finished within " + timeoutMs + " ms");
        this.requestId = requestId;
        this.timeoutMs = timeoutMs;
    }

    public long getRequestId() {
        return requestId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
