package com.phillippitts.modelrelay.service.health;

import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.service.provider.ProviderManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for registered LLM providers.
 *
 * <ul>
 *   <li>UP: every registered provider healthy</li>
 *   <li>DEGRADED: at least one healthy</li>
 *   <li>DOWN: none healthy</li>
 *   <li>UNKNOWN: no provider registered</li>
 * </ul>
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    private final ProviderManager providerManager;

    public ProviderHealthIndicator(ProviderManager providerManager) {
        this.providerManager = providerManager;
    }

    @Override
    public Health health() {
        Map<ProviderId, Boolean> providers = providerManager.registeredProviderHealth();
        Health.Builder builder = new Health.Builder();
        if (providers.isEmpty()) {
            return builder.unknown().withDetail("status", "No providers registered").build();
        }

        long healthy = providers.values().stream().filter(Boolean::booleanValue).count();
        if (healthy == providers.size()) {
            builder.up().withDetail("status", "All providers operational");
        } else if (healthy > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial provider availability");
        } else {
            builder.down().withDetail("status", "No providers available");
        }
        providers.forEach((provider, ok) -> builder.withDetail(provider.displayName(), ok ? "ready" : "unhealthy"));
        return builder.build();
    }
}
