package com.phillippitts.modelrelay.exception;

import java.util.List;

/**
 * Thrown when every provider of a race ended without a result.
 * Carries one failure description per provider, in candidate order.
 */
public class AllProvidersFailedException extends ModelRelayException {

    private final List<String> failures;

    public AllProvidersFailedException(List<String> failures) {
        super("All providers failed: " + String.join("; ", failures));
        this.failures = List.copyOf(failures);
    }

    public List<String> getFailures() {
        return failures;
    }
}
