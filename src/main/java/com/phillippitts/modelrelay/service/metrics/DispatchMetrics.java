package com.phillippitts.modelrelay.service.metrics;

import com.phillippitts.modelrelay.service.dispatch.event.TaskCompletedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for dispatched requests and the response cache.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code modelrelay.request.latency} - start-to-completion time per provider and kind</li>
 *   <li>{@code modelrelay.request.success} / {@code modelrelay.request.failure} - terminal outcomes</li>
 *   <li>{@code modelrelay.cache.hit} / {@code modelrelay.cache.miss} - chat lookups</li>
 * </ul>
 *
 * <p>{@link #NOOP} discards everything; used when no registry is wired.
 */
@Component
public class DispatchMetrics {

    private static final String METRIC_PREFIX = "modelrelay";

    public static final DispatchMetrics NOOP = new DispatchMetrics(null);

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency and outcome of a finished task. Cancelled tasks only count as failures
     * with reason {@code cancelled}; cache hits are not timed.
     */
    public void recordCompletion(TaskCompletedEvent event) {
        if (registry == null) {
            return;
        }
        String provider = event.provider().displayName();
        String kind = event.kind().name().toLowerCase();
        switch (event.status()) {
            case COMPLETED -> {
                if (!event.servedFromCache()) {
                    recordLatency(provider, kind, event.durationMs());
                }
                incrementSuccess(provider, kind);
            }
            case FAILED -> {
                recordLatency(provider, kind, event.durationMs());
                incrementFailure(provider, kind, failureReason(event.errorInfo()));
            }
            case CANCELLED -> incrementFailure(provider, kind, "cancelled");
            default -> throw new IllegalArgumentException("Non-terminal status: " + event.status());
        }
    }

    public void recordLatency(String provider, String kind, long durationMs) {
        if (registry == null) {
            return;
        }
        Timer.builder(METRIC_PREFIX + ".request.latency")
                .description("Time from request submission to completion")
                .tag("provider", provider)
                .tag("kind", kind)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess(String provider, String kind) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".request.success")
                .description("Number of requests completed with a result")
                .tag("provider", provider)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * @param reason timeout, error or cancelled
     */
    public void incrementFailure(String provider, String kind, String reason) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".request.failure")
                .description("Number of requests that ended without a result")
                .tag("provider", provider)
                .tag("kind", kind)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCacheHit() {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".cache.hit")
                .description("Chat requests answered from the response cache")
                .register(registry)
                .increment();
    }

    public void incrementCacheMiss() {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".cache.miss")
                .description("Chat requests that missed the response cache")
                .register(registry)
                .increment();
    }

    private static String failureReason(String errorInfo) {
        if (errorInfo != null && errorInfo.startsWith("Request timed out")) {
            return "timeout";
        }
        return "error";
    }
}
