package com.phillippitts.modelrelay.service.provider;

import com.phillippitts.modelrelay.domain.ProviderCapability;
import com.phillippitts.modelrelay.domain.ProviderId;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.phillippitts.modelrelay.domain.ProviderCapability.CHAT_COMPLETION;
import static com.phillippitts.modelrelay.domain.ProviderCapability.CODE_ANALYSIS;
import static com.phillippitts.modelrelay.domain.ProviderCapability.CODE_COMPLETION;
import static com.phillippitts.modelrelay.domain.ProviderCapability.CODE_EXPLANATION;
import static com.phillippitts.modelrelay.domain.ProviderCapability.STREAMING;

/**
 * Static routing configuration for one provider.
 *
 * @param provider             provider this configuration applies to
 * @param priority             1-10, higher is preferred
 * @param capabilities         features the provider offers
 * @param maxRequestsPerMinute advertised request budget
 * @param timeoutMs            default call timeout
 * @param fallbackProviders    providers to try after this one, in order
 */
public record ProviderConfig(ProviderId provider,
                             int priority,
                             Set<ProviderCapability> capabilities,
                             int maxRequestsPerMinute,
                             long timeoutMs,
                             List<ProviderId> fallbackProviders) {

    public ProviderConfig {
        Objects.requireNonNull(provider, "provider must not be null");
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("priority must be between 1 and 10, got: " + priority);
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        fallbackProviders = fallbackProviders == null ? List.of() : List.copyOf(fallbackProviders);
    }

    public boolean hasCapability(ProviderCapability capability) {
        return capabilities.contains(capability);
    }

    /**
     * Built-in configuration for every known provider.
     * The local GPU service is preferred, local Ollama is the last resort.
     */
    public static Map<ProviderId, ProviderConfig> defaults() {
        Map<ProviderId, ProviderConfig> configs = new EnumMap<>(ProviderId.class);
        configs.put(ProviderId.OPENAI, new ProviderConfig(ProviderId.OPENAI, 8,
                EnumSet.of(CHAT_COMPLETION, CODE_COMPLETION, CODE_EXPLANATION, STREAMING),
                60, 30_000, List.of(ProviderId.CLAUDE, ProviderId.OLLAMA)));
        configs.put(ProviderId.CLAUDE, new ProviderConfig(ProviderId.CLAUDE, 9,
                EnumSet.of(CHAT_COMPLETION, CODE_COMPLETION, CODE_ANALYSIS, CODE_EXPLANATION, STREAMING),
                50, 45_000, List.of(ProviderId.OPENAI, ProviderId.OLLAMA)));
        configs.put(ProviderId.COPILOT, new ProviderConfig(ProviderId.COPILOT, 7,
                EnumSet.of(CODE_COMPLETION, CODE_EXPLANATION),
                100, 15_000, List.of(ProviderId.OPENAI, ProviderId.CLAUDE)));
        configs.put(ProviderId.GHOSTLLM, new ProviderConfig(ProviderId.GHOSTLLM, 10,
                EnumSet.allOf(ProviderCapability.class),
                200, 5_000, List.of(ProviderId.CLAUDE, ProviderId.OPENAI)));
        configs.put(ProviderId.OLLAMA, new ProviderConfig(ProviderId.OLLAMA, 5,
                EnumSet.of(CHAT_COMPLETION, CODE_COMPLETION, CODE_EXPLANATION),
                1000, 60_000, List.of()));
        return configs;
    }
}
