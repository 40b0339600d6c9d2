package com.phillippitts.modelrelay.exception;

import com.phillippitts.modelrelay.domain.ProviderId;

/**
 * Thrown by provider clients when the backend rejects a call with a rate limit response.
 */
public class RateLimitExceededException extends ProviderException {

    private final long retryAfterMs;

    public RateLimitExceededException(ProviderId provider, long retryAfterMs) {
        super(provider, "Rate limit exceeded, retry after " + retryAfterMs + " ms");
        this.retryAfterMs = retryAfterMs;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
