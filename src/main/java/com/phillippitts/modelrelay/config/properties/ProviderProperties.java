package com.phillippitts.modelrelay.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for provider health tracking ({@code relay.providers.*}).
 */
@ConfigurationProperties(prefix = "relay.providers")
@Validated
public class ProviderProperties {

    /** Delay between scheduled health sweeps. */
    @Positive
    private long healthCheckIntervalMs = 300_000;

    /** Health data older than this is refreshed by the next sweep. */
    @Positive
    private long staleAfterSeconds = 300;

    public long getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }

    public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
        this.healthCheckIntervalMs = healthCheckIntervalMs;
    }

    public long getStaleAfterSeconds() {
        return staleAfterSeconds;
    }

    public void setStaleAfterSeconds(long staleAfterSeconds) {
        this.staleAfterSeconds = staleAfterSeconds;
    }
}
