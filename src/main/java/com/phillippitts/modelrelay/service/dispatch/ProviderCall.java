package com.phillippitts.modelrelay.service.dispatch;

import com.phillippitts.modelrelay.service.task.TaskResult;

/**
 * Deferred provider invocation bound to its client and payload.
 * Runs on a dispatch worker thread; any {@link RuntimeException} or {@link Error} marks the task failed.
 */
@FunctionalInterface
public interface ProviderCall {

    TaskResult invoke();
}
