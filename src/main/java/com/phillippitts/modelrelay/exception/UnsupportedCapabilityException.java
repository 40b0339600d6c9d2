package com.phillippitts.modelrelay.exception;

import com.phillippitts.modelrelay.domain.ProviderCapability;
import com.phillippitts.modelrelay.domain.ProviderId;

/**
 * Thrown when a provider client is asked for an operation it does not implement.
 */
public class UnsupportedCapabilityException extends ProviderException {

    private final ProviderCapability capability;

    public UnsupportedCapabilityException(ProviderId provider, ProviderCapability capability) {
        super(provider, "Capability not supported: " + capability);
        this.capability = capability;
    }

    public ProviderCapability getCapability() {
        return capability;
    }
}
