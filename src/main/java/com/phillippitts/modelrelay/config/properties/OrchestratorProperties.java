package com.phillippitts.modelrelay.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the request orchestrator ({@code relay.orchestrator.*}).
 */
@ConfigurationProperties(prefix = "relay.orchestrator")
@Validated
public class OrchestratorProperties {

    /** Executor backend for provider calls. */
    @NotNull
    private DispatchMode dispatchMode = DispatchMode.POOL;

    /** Terminal tasks older than this are purged by the cleanup sweep. */
    @Positive(message = "Cleanup threshold must be positive")
    private long cleanupThresholdSeconds = 300;

    /** Delay between cleanup sweeps. */
    @Positive(message = "Cleanup interval must be positive")
    private long cleanupIntervalMs = 60_000;

    /** Fail tasks that outlive their timeoutMs. */
    private boolean enforceTimeouts = true;

    /** Timeout applied when callers do not pass request options. */
    @PositiveOrZero
    private long defaultTimeoutMs = 30_000;

    public DispatchMode getDispatchMode() {
        return dispatchMode;
    }

    public void setDispatchMode(DispatchMode dispatchMode) {
        this.dispatchMode = dispatchMode;
    }

    public long getCleanupThresholdSeconds() {
        return cleanupThresholdSeconds;
    }

    public void setCleanupThresholdSeconds(long cleanupThresholdSeconds) {
        this.cleanupThresholdSeconds = cleanupThresholdSeconds;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public boolean isEnforceTimeouts() {
        return enforceTimeouts;
    }

    public void setEnforceTimeouts(boolean enforceTimeouts) {
        this.enforceTimeouts = enforceTimeouts;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }
}
