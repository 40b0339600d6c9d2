package com.phillippitts.modelrelay.service.orchestration;

import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.service.cache.TwoTierResponseCache;
import com.phillippitts.modelrelay.service.dispatch.TaskTimeoutEnforcer;
import com.phillippitts.modelrelay.service.metrics.DispatchMetrics;
import com.phillippitts.modelrelay.service.task.RequestOptions;
import com.phillippitts.modelrelay.service.task.RequestTask;
import com.phillippitts.modelrelay.service.task.TaskStatus;
import com.phillippitts.modelrelay.testutil.EventCapturingPublisher;
import com.phillippitts.modelrelay.testutil.FakeProviderClient;
import com.phillippitts.modelrelay.testutil.SyncExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Orchestrator wired the way the application wires it: response cache, metrics, events and deadlines.
 */
class CachedChatOrchestrationTest {

    private static final List<ChatMessage> PROMPT = List.of(
            ChatMessage.system("Answer in one word."),
            ChatMessage.user("Capital of France?"));

    private final MeterRegistry registry = new SimpleMeterRegistry();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final TwoTierResponseCache cache =
            new TwoTierResponseCache(null, Duration.ofMinutes(5), 100, 0.7, 0.9, Clock.systemUTC());
    private ThreadPoolTaskScheduler scheduler;
    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private RequestOrchestrator orchestrator() {
        return RequestOrchestratorBuilder.builder()
                .executor(new SyncExecutor())
                .responseCache(cache)
                .publisher(publisher)
                .metrics(new DispatchMetrics(registry))
                .build();
    }

    @Test
    void shouldServeRepeatedChatFromCache() {
        RequestOrchestrator orchestrator = orchestrator();
        FakeProviderClient client = new FakeProviderClient(ProviderId.OPENAI, "Paris");

        RequestTask first = orchestrator.waitForRequest(
                orchestrator.submitChatRequest(ProviderId.OPENAI, client, PROMPT, "gpt-4", null));
        RequestTask second = orchestrator.waitForRequest(
                orchestrator.submitChatRequest(ProviderId.OPENAI, client, PROMPT, "gpt-4", null));

        assertThat(first.isServedFromCache()).isFalse();
        assertThat(second.isServedFromCache()).isTrue();
        assertThat(second.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(second.getResult()).isEqualTo(first.getResult());
        assertThat(client.callCount()).isEqualTo(1);
        assertThat(cache.stats().hits()).isEqualTo(1);
        assertThat(registry.get("modelrelay.cache.hit").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("modelrelay.cache.miss").counter().count()).isEqualTo(1.0);
        assertThat(publisher.findCompletedEvent(second.getId()).servedFromCache()).isTrue();
    }

    @Test
    void shouldStoreBeforeWaitersWakeUp() {
        pool = Executors.newFixedThreadPool(2);
        RequestOrchestrator orchestrator = RequestOrchestratorBuilder.builder()
                .executor(pool)
                .responseCache(cache)
                .build();
        FakeProviderClient client = new FakeProviderClient(ProviderId.CLAUDE, "Paris", 20);

        orchestrator.waitForRequest(orchestrator.submitChatRequest(ProviderId.CLAUDE, client, PROMPT, "claude-3", null));

        assertThat(cache.get(PROMPT, "claude-3")).isPresent();
    }

    @Test
    void shouldNotCacheFailures() {
        RequestOrchestrator orchestrator = orchestrator();
        FakeProviderClient client = FakeProviderClient.failing(ProviderId.OPENAI, 0);

        orchestrator.submitChatRequest(ProviderId.OPENAI, client, PROMPT, "gpt-4", null);
        client.shouldFail = false;
        long retry = orchestrator.submitChatRequest(ProviderId.OPENAI, client, PROMPT, "gpt-4", null);

        assertThat(orchestrator.waitForRequest(retry).isServedFromCache()).isFalse();
        assertThat(client.callCount()).isEqualTo(2);
        assertThat(registry.get("modelrelay.request.failure").tag("reason", "error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldKeepModelsApart() {
        RequestOrchestrator orchestrator = orchestrator();
        FakeProviderClient client = new FakeProviderClient(ProviderId.OPENAI, "Paris");

        orchestrator.submitChatRequest(ProviderId.OPENAI, client, PROMPT, "gpt-4", null);
        long other = orchestrator.submitChatRequest(ProviderId.OPENAI, client, PROMPT, "gpt-3.5", null);

        assertThat(orchestrator.waitForRequest(other).isServedFromCache()).isFalse();
        assertThat(client.callCount()).isEqualTo(2);
    }

    @Test
    void shouldFailRequestsThatExceedTheirTimeout() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();
        pool = Executors.newFixedThreadPool(2);
        RequestOrchestrator orchestrator = RequestOrchestratorBuilder.builder()
                .executor(pool)
                .responseCache(cache)
                .timeoutEnforcer(new TaskTimeoutEnforcer(scheduler))
                .metrics(new DispatchMetrics(registry))
                .publisher(publisher)
                .build();
        FakeProviderClient slow = new FakeProviderClient(ProviderId.OLLAMA, "eventually", 400);

        long id = orchestrator.submitChatRequest(ProviderId.OLLAMA, slow, PROMPT, "llama", RequestOptions.withTimeout(50));
        RequestTask task = orchestrator.waitForRequest(id);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorInfo()).contains("Request timed out after 50 ms");
        assertThat(registry.get("modelrelay.request.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
        assertThat(cache.get(PROMPT, "llama")).isEmpty();
    }
}
