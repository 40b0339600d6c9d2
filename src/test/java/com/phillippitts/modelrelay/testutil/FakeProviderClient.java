package com.phillippitts.modelrelay.testutil;

import com.phillippitts.modelrelay.domain.AnalysisResponse;
import com.phillippitts.modelrelay.domain.AnalysisType;
import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.CodeContext;
import com.phillippitts.modelrelay.domain.CompletionResponse;
import com.phillippitts.modelrelay.domain.ExplanationResponse;
import com.phillippitts.modelrelay.domain.ProjectContext;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.exception.ProviderException;
import com.phillippitts.modelrelay.service.provider.ProviderCandidate;
import com.phillippitts.modelrelay.service.provider.ProviderClient;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for ProviderClient with configurable output.
 *
 * <p>Allows tests to control:
 * <ul>
 *   <li>Returned content (mutable via {@code cannedContent})</li>
 *   <li>Delay simulation (for race and timeout testing)</li>
 *   <li>Explicit failure mode (throws {@link ProviderException})</li>
 *   <li>Local readiness reported by {@link #isHealthy()}</li>
 * </ul>
 * Also records call count and the highest number of calls in flight at once.
 */
public class FakeProviderClient implements ProviderClient {
    private final ProviderId provider;
    public volatile String cannedContent; // Mutable for dynamic test scenarios
    public volatile boolean shouldFail;
    public volatile boolean healthy = true;
    private final long delayMs;

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    public FakeProviderClient(ProviderId provider, String content) {
        this(provider, content, 0, false);
    }

    public FakeProviderClient(ProviderId provider, String content, long delayMs) {
        this(provider, content, delayMs, false);
    }

    public FakeProviderClient(ProviderId provider, String content, long delayMs, boolean shouldFail) {
        this.provider = provider;
        this.cannedContent = content;
        this.delayMs = delayMs;
        this.shouldFail = shouldFail;
    }

    public static FakeProviderClient failing(ProviderId provider, long delayMs) {
        return new FakeProviderClient(provider, "unused", delayMs, true);
    }

    public ProviderCandidate candidate() {
        return ProviderCandidate.of(this);
    }

    @Override
    public ProviderId provider() {
        return provider;
    }

    @Override
    public ChatResponse chatCompletion(List<ChatMessage> messages, String model) {
        simulateCall();
        return ChatResponse.of(cannedContent, model);
    }

    @Override
    public AnalysisResponse analyzeCode(String code, AnalysisType type, ProjectContext projectContext) {
        simulateCall();
        return new AnalysisResponse(cannedContent + " (" + type + ")", List.of("extract method"), 0.8);
    }

    @Override
    public CompletionResponse codeCompletion(String prompt, CodeContext codeContext) {
        simulateCall();
        return new CompletionResponse(cannedContent, "completion-model", null);
    }

    @Override
    public ExplanationResponse explainCode(String code, CodeContext codeContext) {
        simulateCall();
        return new ExplanationResponse(cannedContent, List.of(), List.of());
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    public int callCount() {
        return calls.get();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    private void simulateCall() {
        calls.incrementAndGet();
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException(provider, "Call interrupted", e);
                }
            }
            if (shouldFail) {
                throw new ProviderException(provider, "Provider configured to fail");
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
