package com.phillippitts.modelrelay.service.task;

import java.util.Objects;

/**
 * Per-request tuning.
 *
 * <p>{@code retryCount} is carried for provider adapters that implement their own retries.
 * The relay itself never re-submits a failed task.
 *
 * @param timeoutMs  deadline for the task measured from submission; {@code <= 0} disables it
 * @param retryCount retry budget advertised to adapters
 * @param priority   caller-assigned priority
 */
public record RequestOptions(long timeoutMs, int retryCount, RequestPriority priority) {

    public static final long DEFAULT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_RETRY_COUNT = 3;

    public static final RequestOptions DEFAULTS =
            new RequestOptions(DEFAULT_TIMEOUT_MS, DEFAULT_RETRY_COUNT, RequestPriority.NORMAL);

    public RequestOptions {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, got: " + retryCount);
        }
        Objects.requireNonNull(priority, "priority must not be null");
    }

    public static RequestOptions withTimeout(long timeoutMs) {
        return new RequestOptions(timeoutMs, DEFAULT_RETRY_COUNT, RequestPriority.NORMAL);
    }

    public RequestOptions withPriority(RequestPriority newPriority) {
        return new RequestOptions(timeoutMs, retryCount, newPriority);
    }
}
