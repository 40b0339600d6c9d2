package com.phillippitts.modelrelay.service.provider;

import com.phillippitts.modelrelay.domain.ProviderId;

import java.util.Objects;

/**
 * Pairs a provider with the client used to reach it in race and broadcast operations.
 */
public record ProviderCandidate(ProviderId provider, ProviderClient client) {

    public ProviderCandidate {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(client, "client must not be null");
    }

    public static ProviderCandidate of(ProviderClient client) {
        return new ProviderCandidate(client.provider(), client);
    }
}
