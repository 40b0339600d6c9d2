package com.phillippitts.modelrelay.exception;

import com.phillippitts.modelrelay.domain.ProviderId;

/**
 * Thrown by provider clients when a backend call fails.
 */
public class ProviderException extends ModelRelayException {

    private final ProviderId provider;

    public ProviderException(ProviderId provider, String message) {
        super(message + " (provider: " + displayName(provider) + ")");
        this.provider = provider;
    }

    public ProviderException(ProviderId provider, String message, Throwable cause) {
        super(message + " (provider: " + displayName(provider) + ")", cause);
        this.provider = provider;
    }

    public ProviderId getProvider() {
        return provider;
    }

    private static String displayName(ProviderId provider) {
        return provider == null ? "unknown" : provider.displayName();
    }
}
