package com.phillippitts.modelrelay.service.assistant;

import com.phillippitts.modelrelay.domain.AnalysisResponse;
import com.phillippitts.modelrelay.domain.AnalysisType;
import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.ProjectContext;
import com.phillippitts.modelrelay.domain.ProviderCapability;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.exception.AllProvidersFailedException;
import com.phillippitts.modelrelay.exception.NoProvidersException;
import com.phillippitts.modelrelay.service.cache.CacheStats;
import com.phillippitts.modelrelay.service.cache.ResponseCache;
import com.phillippitts.modelrelay.service.orchestration.RequestOrchestrator;
import com.phillippitts.modelrelay.service.provider.ProviderCandidate;
import com.phillippitts.modelrelay.service.provider.ProviderClient;
import com.phillippitts.modelrelay.service.provider.ProviderManager;
import com.phillippitts.modelrelay.service.task.RequestOptions;
import com.phillippitts.modelrelay.service.task.RequestStats;
import com.phillippitts.modelrelay.service.task.RequestTask;
import com.phillippitts.modelrelay.service.task.TaskResult;
import com.phillippitts.modelrelay.service.task.TaskStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * High-level entry point for callers that think in providers rather than clients.
 *
 * <p>Resolves provider ids to clients through the {@link ProviderManager} and delegates to the
 * {@link RequestOrchestrator}. Also owns the periodic cleanup of finished requests.
 */
@Service
public class ConcurrentAssistant {

    private static final Logger LOG = LogManager.getLogger(ConcurrentAssistant.class);

    /** Per-provider deadline for parallel operations. */
    static final long PARALLEL_TIMEOUT_MS = 15_000;

    private final RequestOrchestrator orchestrator;
    private final ProviderManager providerManager;
    private final ResponseCache responseCache;

    public ConcurrentAssistant(RequestOrchestrator orchestrator,
                               ProviderManager providerManager,
                               ResponseCache responseCache) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.providerManager = Objects.requireNonNull(providerManager, "providerManager");
        this.responseCache = Objects.requireNonNull(responseCache, "responseCache");
    }

    /**
     * Races the chat across the given providers and returns the first successful response.
     *
     * @throws NoProvidersException        if none of the providers has a registered client
     * @throws AllProvidersFailedException if every provider failed
     */
    public ChatResponse parallelChat(List<ChatMessage> messages, String model, List<ProviderId> providers) {
        List<ProviderCandidate> candidates = resolve(providers, "parallel chat");
        return orchestrator.raceProviders(messages, candidates, model, RequestOptions.withTimeout(PARALLEL_TIMEOUT_MS));
    }

    /**
     * Runs the analysis on every given provider and returns the first successful result.
     */
    public AnalysisResponse parallelAnalysis(String code,
                                             AnalysisType analysisType,
                                             ProjectContext projectContext,
                                             List<ProviderId> providers) {
        List<ProviderCandidate> candidates = resolve(providers, "parallel analysis");
        List<Long> ids = new ArrayList<>(candidates.size());
        for (ProviderCandidate candidate : candidates) {
            ids.add(orchestrator.submitCodeAnalysisRequest(candidate.provider(), candidate.client(), code,
                    analysisType, projectContext, RequestOptions.withTimeout(PARALLEL_TIMEOUT_MS)));
        }
        RequestTask winner = orchestrator.awaitFirstSuccess(ids, 0);
        return winner.getResult()
                .map(r -> ((TaskResult.CodeAnalysis) r).response())
                .orElseThrow(() -> new AllProvidersFailedException(List.of("analysis result missing")));
    }

    /**
     * Sends the chat to the best provider for the capability and walks its fallback list until
     * one succeeds.
     *
     * @throws NoProvidersException        if no provider with a client offers the capability
     * @throws AllProvidersFailedException if the primary and every fallback failed
     */
    public ChatResponse chat(List<ChatMessage> messages, String model, ProviderCapability capability) {
        List<ProviderCandidate> candidates = providerManager.candidates(capability);
        if (candidates.isEmpty()) {
            throw new NoProvidersException("chat with capability " + capability);
        }
        List<String> failures = new ArrayList<>();
        for (ProviderCandidate candidate : candidates) {
            long id = orchestrator.submitChatRequest(candidate.provider(), candidate.client(), messages, model, null);
            RequestTask task = orchestrator.waitForRequest(id);
            orchestrator.removeRequest(id);
            if (task.getStatus() == TaskStatus.COMPLETED) {
                return task.getResult()
                        .map(r -> ((TaskResult.ChatCompletion) r).response())
                        .orElseThrow();
            }
            String reason = task.getErrorInfo().orElse(task.getStatus().name().toLowerCase());
            LOG.warn("Provider {} failed, trying next fallback: {}", candidate.provider().displayName(), reason);
            failures.add(candidate.provider().displayName() + ": " + reason);
        }
        throw new AllProvidersFailedException(failures);
    }

    public RequestStats stats() {
        return orchestrator.getRequestStats();
    }

    public CacheStats cacheStats() {
        return responseCache.stats();
    }

    /**
     * Removes finished requests older than the cleanup threshold.
     *
     * @return number of removed requests
     */
    public int cleanup() {
        return orchestrator.cleanupCompletedTasks();
    }

    @Scheduled(fixedDelayString = "${relay.orchestrator.cleanup-interval-ms:60000}",
            initialDelayString = "${relay.orchestrator.cleanup-interval-ms:60000}")
    public void scheduledCleanup() {
        int removed = cleanup();
        if (removed > 0) {
            CacheStats cache = cacheStats();
            LOG.info("Cache: entries={}/{}, hitRate={}", cache.entries(), cache.maxEntries(),
                    String.format("%.2f", cache.hitRate()));
        }
    }

    private List<ProviderCandidate> resolve(List<ProviderId> providers, String operation) {
        List<ProviderCandidate> candidates = new ArrayList<>(providers.size());
        for (ProviderId provider : providers) {
            Optional<ProviderClient> client = providerManager.client(provider);
            if (client.isPresent()) {
                candidates.add(new ProviderCandidate(provider, client.get()));
            } else {
                LOG.warn("No client registered for provider {}; skipping", provider.displayName());
            }
        }
        if (candidates.isEmpty()) {
            throw new NoProvidersException(operation);
        }
        return candidates;
    }
}
