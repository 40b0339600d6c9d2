package com.phillippitts.modelrelay.service.provider;

import com.phillippitts.modelrelay.domain.ProviderId;

import java.time.Duration;
import java.time.Instant;

/**
 * Last observed health of a provider.
 *
 * @param errorRate exponential moving average of call failures, 0.0 to 1.0
 */
public record ProviderHealth(ProviderId provider,
                             boolean healthy,
                             Instant lastCheck,
                             long responseTimeMs,
                             double errorRate) {

    /** Weight given to the previous error rate when folding in a new observation. */
    static final double ERROR_RATE_DECAY = 0.9;

    static ProviderHealth initial(ProviderId provider, Instant now) {
        return new ProviderHealth(provider, true, now, 0, 0.0);
    }

    /**
     * Folds one call outcome into this health record.
     */
    ProviderHealth observe(boolean success, long responseTimeMs, Instant now) {
        double errorValue = success ? 0.0 : 1.0;
        double rate = errorRate * ERROR_RATE_DECAY + errorValue * (1.0 - ERROR_RATE_DECAY);
        return new ProviderHealth(provider, success, now, responseTimeMs, rate);
    }

    public boolean isStale(Instant now, Duration staleAfter) {
        return lastCheck.plus(staleAfter).isBefore(now);
    }
}
