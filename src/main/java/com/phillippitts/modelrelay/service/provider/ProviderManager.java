package com.phillippitts.modelrelay.service.provider;

import com.phillippitts.modelrelay.config.properties.ProviderProperties;
import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ProviderCapability;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.service.dispatch.event.TaskCompletedEvent;
import com.phillippitts.modelrelay.service.task.TaskStatus;
import com.phillippitts.modelrelay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Tracks provider configuration, client instances and observed health, and ranks providers
 * for a capability.
 *
 * <p>Score of a provider for a capability:
 * <pre>
 * score = priority
 *       x 0.1                  if last observation was unhealthy
 *       x 1000 / responseMs    if a response time is known
 *       x (1 - errorRate)
 * </pre>
 * Providers without a registered client or without the capability are never selected.
 *
 * <p>Health is fed from two sources: every finished task ({@link TaskCompletedEvent}) and a
 * scheduled ping sweep over providers whose health data is stale.
 */
@Component
public class ProviderManager {

    private static final Logger LOG = LogManager.getLogger(ProviderManager.class);

    static final long FAILED_CHECK_RESPONSE_MS = 30_000;
    static final String HEALTH_CHECK_MODEL = "health-check";

    private final Map<ProviderId, ProviderConfig> configs;
    private final ConcurrentMap<ProviderId, ProviderClient> clients = new ConcurrentHashMap<>();
    private final ConcurrentMap<ProviderId, ProviderHealth> health = new ConcurrentHashMap<>();
    private final ProviderProperties properties;
    private final Clock clock;

    @Autowired
    public ProviderManager(ObjectProvider<ProviderClient> clientBeans, ProviderProperties properties) {
        this(clientBeans.orderedStream().collect(Collectors.toList()), properties, Clock.systemUTC());
    }

    public ProviderManager(List<ProviderClient> clientList, ProviderProperties properties, Clock clock) {
        this.configs = ProviderConfig.defaults();
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (ProviderClient client : clientList) {
            registerClient(client);
        }
        LOG.info("Provider manager initialized with clients={}", clients.keySet());
    }

    /**
     * Registers (or replaces) the client for its provider.
     */
    public void registerClient(ProviderClient client) {
        Objects.requireNonNull(client, "client");
        ProviderClient previous = clients.put(client.provider(), client);
        if (previous != null && previous != client) {
            LOG.info("Replaced client for provider {}", client.provider().displayName());
        }
    }

    public Optional<ProviderClient> client(ProviderId provider) {
        return Optional.ofNullable(clients.get(provider));
    }

    public Optional<ProviderConfig> getProviderConfig(ProviderId provider) {
        return Optional.ofNullable(configs.get(provider));
    }

    public Optional<ProviderHealth> getProviderHealth(ProviderId provider) {
        return Optional.ofNullable(health.get(provider));
    }

    /**
     * Highest scoring provider with a client and the capability, empty if none scores above zero.
     */
    public Optional<ProviderId> selectBestProvider(ProviderCapability capability) {
        ProviderId best = null;
        double bestScore = 0.0;
        for (ProviderConfig config : configs.values()) {
            if (!config.hasCapability(capability) || !clients.containsKey(config.provider())) {
                continue;
            }
            double score = score(config);
            if (score > bestScore) {
                bestScore = score;
                best = config.provider();
            }
        }
        return Optional.ofNullable(best);
    }

    double score(ProviderConfig config) {
        double score = config.priority();
        ProviderHealth h = health.get(config.provider());
        if (h != null) {
            if (!h.healthy()) {
                score *= 0.1;
            }
            if (h.responseTimeMs() > 0) {
                score *= 1000.0 / h.responseTimeMs();
            }
            score *= 1.0 - h.errorRate();
        }
        return score;
    }

    /**
     * Best provider followed by its configured fallbacks that also offer the capability and have a client.
     */
    public List<ProviderId> selectProvidersWithFallback(ProviderCapability capability) {
        List<ProviderId> result = new ArrayList<>();
        Optional<ProviderId> primary = selectBestProvider(capability);
        if (primary.isEmpty()) {
            return result;
        }
        result.add(primary.get());
        for (ProviderId fallback : configs.get(primary.get()).fallbackProviders()) {
            ProviderConfig fallbackConfig = configs.get(fallback);
            if (fallbackConfig != null
                    && fallbackConfig.hasCapability(capability)
                    && clients.containsKey(fallback)
                    && !result.contains(fallback)) {
                result.add(fallback);
            }
        }
        return result;
    }

    /**
     * {@link #selectProvidersWithFallback} resolved to candidates ready for race or broadcast.
     */
    public List<ProviderCandidate> candidates(ProviderCapability capability) {
        List<ProviderCandidate> result = new ArrayList<>();
        for (ProviderId provider : selectProvidersWithFallback(capability)) {
            result.add(new ProviderCandidate(provider, clients.get(provider)));
        }
        return result;
    }

    /**
     * Providers with the capability whose last observation was healthy. Providers without
     * health data count as healthy.
     */
    public List<ProviderId> listHealthyProviders(ProviderCapability capability) {
        List<ProviderId> result = new ArrayList<>();
        for (ProviderConfig config : configs.values()) {
            if (!config.hasCapability(capability)) {
                continue;
            }
            ProviderHealth h = health.get(config.provider());
            if (h == null || h.healthy()) {
                result.add(config.provider());
            }
        }
        return result;
    }

    /**
     * Folds one call outcome into the provider's health.
     */
    public void updateHealth(ProviderId provider, boolean success, long responseTimeMs) {
        Instant now = clock.instant();
        ProviderHealth updated = health.compute(provider, (p, current) ->
                (current == null ? ProviderHealth.initial(p, now) : current).observe(success, responseTimeMs, now));
        LOG.debug("Provider {} health: healthy={}, responseMs={}, errorRate={}",
                provider.displayName(), updated.healthy(), updated.responseTimeMs(), updated.errorRate());
    }

    /**
     * Sends a one-message ping through the provider's client and records the outcome.
     *
     * @return false when the ping failed or no client is registered
     */
    public boolean healthCheck(ProviderId provider) {
        ProviderClient client = clients.get(provider);
        if (client == null) {
            return false;
        }
        long start = System.nanoTime();
        boolean healthy;
        try {
            client.chatCompletion(List.of(ChatMessage.user("ping")), HEALTH_CHECK_MODEL);
            healthy = true;
        } catch (RuntimeException e) {
            LOG.warn("Health check failed for provider {}: {}", provider.displayName(), e.toString());
            healthy = false;
        }
        long elapsedMs = TimeUtils.elapsedMillis(start);
        updateHealth(provider, healthy, healthy ? elapsedMs : FAILED_CHECK_RESPONSE_MS);
        return healthy;
    }

    /**
     * Pings every registered provider whose health data is missing or stale.
     */
    @Scheduled(fixedDelayString = "${relay.providers.health-check-interval-ms:300000}",
            initialDelayString = "${relay.providers.health-check-interval-ms:300000}")
    public void performHealthChecks() {
        Duration staleAfter = Duration.ofSeconds(properties.getStaleAfterSeconds());
        Instant now = clock.instant();
        int checked = 0;
        for (ProviderId provider : clients.keySet()) {
            ProviderHealth h = health.get(provider);
            if (h != null && !h.isStale(now, staleAfter)) {
                continue;
            }
            healthCheck(provider);
            checked++;
        }
        if (checked > 0) {
            LOG.info("Health sweep checked {} provider(s)", checked);
        }
    }

    /**
     * Feeds finished provider calls into health tracking. Cache hits and cancellations say
     * nothing about the provider and are ignored.
     */
    @EventListener
    public void onTaskCompleted(TaskCompletedEvent event) {
        if (event.servedFromCache() || event.status() == TaskStatus.CANCELLED) {
            return;
        }
        updateHealth(event.provider(), event.succeeded(), event.durationMs());
    }

    /**
     * Registered providers with their health, for the actuator indicator.
     */
    public Map<ProviderId, Boolean> registeredProviderHealth() {
        Map<ProviderId, Boolean> result = new EnumMap<>(ProviderId.class);
        for (ProviderId provider : clients.keySet()) {
            ProviderClient client = clients.get(provider);
            ProviderHealth h = health.get(provider);
            result.put(provider, client.isHealthy() && (h == null || h.healthy()));
        }
        return result;
    }
}
