package com.phillippitts.modelrelay.service.orchestration;

import com.phillippitts.modelrelay.service.task.RequestTask;

import java.util.List;
import java.util.function.Consumer;

/**
 * Settings for {@link RequestOrchestrator#submitBatchRequests(List, BatchOptions)}.
 *
 * @param maxConcurrent upper bound on batch tasks in flight at once
 * @param failFast      stop submitting once any task of the batch has failed
 * @param timeoutMs     total time the submitter may spend waiting for concurrency permits
 * @param callback      optional, receives every submitted task once all of them are terminal
 */
public record BatchOptions(int maxConcurrent,
                           boolean failFast,
                           long timeoutMs,
                           Consumer<List<RequestTask>> callback) {

    public static final BatchOptions DEFAULTS = new BatchOptions(5, false, 60_000, null);

    public BatchOptions {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive, got: " + maxConcurrent);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
        }
    }

    public static BatchOptions withMaxConcurrent(int maxConcurrent) {
        return new BatchOptions(maxConcurrent, false, DEFAULTS.timeoutMs(), null);
    }
}
