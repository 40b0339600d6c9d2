package com.phillippitts.modelrelay.service.dispatch;

import com.phillippitts.modelrelay.service.task.RequestTask;
import com.phillippitts.modelrelay.service.task.TaskKind;
import com.phillippitts.modelrelay.service.task.TaskResult;
import com.phillippitts.modelrelay.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs provider calls for tasks on an {@link Executor} and records the outcome on the task.
 *
 * <p>Per task:
 * <ol>
 *   <li>PENDING -> IN_PROGRESS; the call is skipped when the task was cancelled while queued</li>
 *   <li>success -> COMPLETED with the call's result</li>
 *   <li>exception -> FAILED with a message such as {@code "Chat completion failed: <cause>"}</li>
 *   <li>{@link Error} -> FAILED as above; a {@link VirtualMachineError} is rethrown afterwards</li>
 * </ol>
 * A task that reached a terminal state while its call was running (cancel, timeout) keeps that
 * state; the late outcome is dropped.
 *
 * <p>The worker sets the {@code taskId} and {@code provider} log context keys for the duration of the call.
 *
 * <p>An optional {@code onCallFinished} hook runs once the provider call has returned, or once the
 * call is known never to start (cancelled while queued, rejected by the executor).
 */
public class DispatchWorker {

    private static final Logger LOG = LogManager.getLogger(DispatchWorker.class);

    static final String MDC_TASK_ID = "taskId";
    static final String MDC_PROVIDER = "provider";

    private static final int ERROR_PREVIEW_CHARS = 200;

    private final Executor executor;

    public DispatchWorker(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Queues the call for execution. Never blocks unless the executor runs tasks on the caller
     * (caller-runs backpressure or a synchronous executor).
     */
    public void dispatch(RequestTask task, ProviderCall call) {
        dispatch(task, call, null);
    }

    /**
     * @param onCallFinished runs after the provider call returns or is skipped; may be null
     */
    public void dispatch(RequestTask task, ProviderCall call, Runnable onCallFinished) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(call, "call");
        try {
            executor.execute(() -> {
                try {
                    run(task, call);
                } finally {
                    finished(task, onCallFinished);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Dispatch rejected for task {}: {}", task.getId(), e.toString());
            task.fail("Dispatch rejected: " + e.getMessage());
            finished(task, onCallFinished);
        }
    }

    private static void finished(RequestTask task, Runnable onCallFinished) {
        if (onCallFinished == null) {
            return;
        }
        try {
            onCallFinished.run();
        } catch (RuntimeException e) {
            LOG.warn("Call-finished hook for task {} threw: {}", task.getId(), e.toString());
        }
    }

    void run(RequestTask task, ProviderCall call) {
        if (!task.markInProgress()) {
            LOG.debug("Skipping task {} in state {}", task.getId(), task.getStatus());
            return;
        }
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext
                .put(MDC_TASK_ID, String.valueOf(task.getId()))
                .put(MDC_PROVIDER, task.getProvider().displayName())) {
            TaskResult result;
            try {
                result = call.invoke();
            } catch (RuntimeException e) {
                String reason = failurePrefix(task.getKind()) + ": "
                        + LogSanitizer.truncate(describe(e), ERROR_PREVIEW_CHARS);
                LOG.warn("Task {} failed on {}: {}", task.getId(), task.getProvider().displayName(), reason);
                if (!task.fail(reason)) {
                    LOG.debug("Discarding late failure for task {} ({})", task.getId(), task.getStatus());
                }
                return;
            } catch (Error e) {
                String reason = failurePrefix(task.getKind()) + ": " + e.getClass().getSimpleName()
                        + (e.getMessage() != null ? " " + LogSanitizer.truncate(e.getMessage(), ERROR_PREVIEW_CHARS) : "");
                LOG.error("Task {} failed on {} with {}", task.getId(), task.getProvider().displayName(), e.toString(), e);
                task.fail(reason);
                if (e instanceof VirtualMachineError) {
                    throw e;
                }
                return;
            }
            if (result == null) {
                task.fail(failurePrefix(task.getKind()) + ": provider returned no result");
                return;
            }
            if (!task.complete(result)) {
                LOG.debug("Discarding late result for task {} ({})", task.getId(), task.getStatus());
            }
        }
    }

    static String failurePrefix(TaskKind kind) {
        return switch (kind) {
            case CHAT_COMPLETION -> "Chat completion failed";
            case CODE_COMPLETION -> "Code completion failed";
            case CODE_ANALYSIS -> "Code analysis failed";
            case CODE_EXPLANATION -> "Code explanation failed";
            case HEALTH_CHECK -> "Health check failed";
        };
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
