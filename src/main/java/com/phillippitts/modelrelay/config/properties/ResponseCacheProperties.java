package com.phillippitts.modelrelay.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the chat response cache ({@code relay.cache.*}).
 */
@ConfigurationProperties(prefix = "relay.cache")
@Validated
public class ResponseCacheProperties {

    /** When false every lookup misses and nothing is stored. */
    private boolean enabled = true;

    @Positive(message = "Cache TTL must be positive")
    private long ttlSeconds = 3600;

    /** Capacity of the in-memory tier; the durable tier is trimmed to the same size. */
    @Positive(message = "Cache max entries must be positive")
    private int maxEntries = 10_000;

    /** Keep a SQLite copy of every entry so the cache survives restarts. */
    private boolean persistent = true;

    @NotBlank
    private String dbPath = "cache/modelrelay.db";

    /** Sampling temperature folded into the cache key. */
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.7;

    /** Nucleus sampling value folded into the cache key. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double topP = 0.9;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public void setPersistent(boolean persistent) {
        this.persistent = persistent;
    }

    public String getDbPath() {
        return dbPath;
    }

    public void setDbPath(String dbPath) {
        this.dbPath = dbPath;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public double getTopP() {
        return topP;
    }

    public void setTopP(double topP) {
        this.topP = topP;
    }
}
