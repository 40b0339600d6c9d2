package com.phillippitts.modelrelay.service.task;

import com.phillippitts.modelrelay.domain.ProviderId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A single unit of provider work tracked by the {@link TaskRegistry}.
 *
 * <p>All state changes go through the transition methods ({@link #markInProgress()},
 * {@link #complete(TaskResult)}, {@link #fail(String)}, {@link #cancel()}), which are guarded by
 * the task's monitor and refuse to leave a terminal state. Exactly one caller wins the terminal
 * transition; that caller then runs the callback and completes {@link #completion()}.
 *
 * <p>Callback thread: the callback runs on whichever thread performed the terminal transition,
 * usually a dispatch worker, but also a cancelling caller or the timeout scheduler.
 * Callbacks must be short and must not block.
 *
 * <p>Status is {@code volatile}, so polling readers never take the lock.
 */
public final class RequestTask {

    private static final Logger LOG = LogManager.getLogger(RequestTask.class);

    private final long id;
    private final ProviderId provider;
    private final TaskKind kind;
    private final RequestOptions options;
    private final Instant startTime;
    private final Consumer<RequestTask> callback;
    private final Clock clock;
    private final CompletableFuture<RequestTask> completion = new CompletableFuture<>();

    private volatile TaskStatus status = TaskStatus.PENDING;
    private TaskResult result;
    private String errorInfo;
    private Instant completionTime;
    private boolean servedFromCache;

    RequestTask(long id,
                ProviderId provider,
                TaskKind kind,
                RequestOptions options,
                Consumer<RequestTask> callback,
                Clock clock) {
        this.id = id;
        this.provider = Objects.requireNonNull(provider, "provider");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.options = options == null ? RequestOptions.DEFAULTS : options;
        this.callback = callback;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startTime = clock.instant();
    }

    /**
     * Moves a pending task to {@link TaskStatus#IN_PROGRESS}.
     *
     * @return false if the task is no longer pending (e.g. cancelled while queued)
     */
    public synchronized boolean markInProgress() {
        if (status != TaskStatus.PENDING) {
            return false;
        }
        status = TaskStatus.IN_PROGRESS;
        return true;
    }

    /**
     * Completes the task with a result unless it is already terminal.
     *
     * @return true if this call performed the terminal transition
     */
    public boolean complete(TaskResult taskResult) {
        Objects.requireNonNull(taskResult, "taskResult");
        return finish(TaskStatus.COMPLETED, taskResult, null, false);
    }

    /**
     * Completes an in-progress task with a response taken from the response cache.
     *
     * @return false if the task was not {@link TaskStatus#IN_PROGRESS}
     */
    public boolean completeFromCache(TaskResult taskResult) {
        Objects.requireNonNull(taskResult, "taskResult");
        return finish(TaskStatus.COMPLETED, taskResult, null, true);
    }

    /**
     * Fails the task unless it is already terminal.
     *
     * @return true if this call performed the terminal transition
     */
    public boolean fail(String reason) {
        return finish(TaskStatus.FAILED, null, reason == null ? "unknown error" : reason, false);
    }

    /**
     * Cancels the task unless it is already terminal. An in-flight provider call keeps running;
     * its outcome is discarded when it returns.
     *
     * @return true if this call performed the terminal transition
     */
    public boolean cancel() {
        return finish(TaskStatus.CANCELLED, null, null, false);
    }

    private boolean finish(TaskStatus terminal, TaskResult taskResult, String error, boolean fromCache) {
        synchronized (this) {
            if (status.isTerminal() || (fromCache && status != TaskStatus.IN_PROGRESS)) {
                return false;
            }
            this.result = taskResult;
            this.errorInfo = error;
            this.servedFromCache = fromCache;
            this.completionTime = clock.instant();
            this.status = terminal;
        }
        LOG.debug("Task {} ({}/{}) -> {}", id, provider.displayName(), kind, terminal);
        notifyTerminal();
        return true;
    }

    private void notifyTerminal() {
        if (callback != null) {
            try {
                callback.accept(this);
            } catch (RuntimeException e) {
                LOG.warn("Callback for task {} threw: {}", id, e.toString());
            }
        }
        completion.complete(this);
    }

    public long getId() {
        return id;
    }

    public ProviderId getProvider() {
        return provider;
    }

    public TaskKind getKind() {
        return kind;
    }

    public RequestOptions getOptions() {
        return options;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized Optional<TaskResult> getResult() {
        return Optional.ofNullable(result);
    }

    public synchronized Optional<String> getErrorInfo() {
        return Optional.ofNullable(errorInfo);
    }

    public synchronized Optional<Instant> getCompletionTime() {
        return Optional.ofNullable(completionTime);
    }

    public synchronized boolean isServedFromCache() {
        return servedFromCache;
    }

    /**
     * Start-to-completion duration, empty while the task is not terminal.
     */
    public synchronized Optional<Duration> getDuration() {
        if (completionTime == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startTime, completionTime));
    }

    /**
     * Future completed with this task right after its terminal transition.
     * The returned future is a copy; completing it has no effect on the task.
     */
    public CompletableFuture<RequestTask> completion() {
        return completion.copy();
    }

    @Override
    public String toString() {
        return "RequestTask{id=" + id
                + ", provider=" + provider.displayName()
                + ", kind=" + kind
                + ", status=" + status + '}';
    }
}
