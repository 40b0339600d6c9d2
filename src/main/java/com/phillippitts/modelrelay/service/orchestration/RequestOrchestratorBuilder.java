package com.phillippitts.modelrelay.service.orchestration;

import com.phillippitts.modelrelay.config.properties.OrchestratorProperties;
import com.phillippitts.modelrelay.service.cache.NoOpResponseCache;
import com.phillippitts.modelrelay.service.cache.ResponseCache;
import com.phillippitts.modelrelay.service.dispatch.DispatchWorker;
import com.phillippitts.modelrelay.service.dispatch.TaskTimeoutEnforcer;
import com.phillippitts.modelrelay.service.metrics.DispatchMetrics;
import com.phillippitts.modelrelay.service.task.TaskRegistry;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultRequestOrchestrator}.
 *
 * <p>Only the executor is required. Everything else falls back to an inert default, which keeps
 * unit tests short:
 * <pre>{@code
 * RequestOrchestrator orchestrator = RequestOrchestratorBuilder.builder()
 *     .executor(new SyncExecutor())
 *     .responseCache(cache)
 *     .build();
 * }</pre>
 */
public final class RequestOrchestratorBuilder {

    private Executor executor;
    private ResponseCache responseCache;
    private TaskTimeoutEnforcer timeoutEnforcer;
    private ApplicationEventPublisher publisher;
    private DispatchMetrics metrics;
    private OrchestratorProperties properties;
    private Clock clock;

    private RequestOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static RequestOrchestratorBuilder builder() {
        return new RequestOrchestratorBuilder();
    }

    /**
     * @param executor executor that runs provider calls (required)
     * @return this builder
     */
    public RequestOrchestratorBuilder executor(Executor executor) {
        this.executor = executor;
        return this;
    }

    /**
     * @param responseCache chat response cache; defaults to a cache that always misses
     * @return this builder
     */
    public RequestOrchestratorBuilder responseCache(ResponseCache responseCache) {
        this.responseCache = responseCache;
        return this;
    }

    /**
     * @param timeoutEnforcer deadline enforcement; defaults to disabled
     * @return this builder
     */
    public RequestOrchestratorBuilder timeoutEnforcer(TaskTimeoutEnforcer timeoutEnforcer) {
        this.timeoutEnforcer = timeoutEnforcer;
        return this;
    }

    /**
     * @param publisher receives a completion event per task; defaults to discarding them
     * @return this builder
     */
    public RequestOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public RequestOrchestratorBuilder metrics(DispatchMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    public RequestOrchestratorBuilder properties(OrchestratorProperties properties) {
        this.properties = properties;
        return this;
    }

    /**
     * @param clock time source for task timestamps and cleanup; defaults to the UTC system clock
     * @return this builder
     */
    public RequestOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if the executor is missing
     */
    public DefaultRequestOrchestrator build() {
        Objects.requireNonNull(executor, "executor is required");
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
        return new DefaultRequestOrchestrator(
                new TaskRegistry(effectiveClock),
                new DispatchWorker(executor),
                responseCache != null ? responseCache : NoOpResponseCache.INSTANCE,
                timeoutEnforcer != null ? timeoutEnforcer : TaskTimeoutEnforcer.disabled(),
                publisher != null ? publisher : event -> { },
                metrics != null ? metrics : DispatchMetrics.NOOP,
                properties != null ? properties : new OrchestratorProperties(),
                effectiveClock);
    }
}
