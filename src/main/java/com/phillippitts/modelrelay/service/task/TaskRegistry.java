package com.phillippitts.modelrelay.service.task;

import com.phillippitts.modelrelay.domain.ProviderId;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Thread-safe map of request id to {@link RequestTask}.
 *
 * <p>Ids start at 1 and increase strictly for the lifetime of the registry; removed ids are never reused.
 */
public class TaskRegistry {

    private final ConcurrentMap<Long, RequestTask> tasks = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final AtomicLong totalSubmitted = new AtomicLong();
    private final Clock clock;

    public TaskRegistry() {
        this(Clock.systemUTC());
    }

    public TaskRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates and registers a new {@link TaskStatus#PENDING} task.
     *
     * @param callback optional, invoked once after the terminal transition
     */
    public RequestTask create(TaskKind kind,
                              ProviderId provider,
                              RequestOptions options,
                              Consumer<RequestTask> callback) {
        long id = nextId.getAndIncrement();
        RequestTask task = new RequestTask(id, provider, kind, options, callback, clock);
        tasks.put(id, task);
        totalSubmitted.incrementAndGet();
        return task;
    }

    public Optional<RequestTask> get(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public Optional<RequestTask> remove(long id) {
        return Optional.ofNullable(tasks.remove(id));
    }

    /** Copy of all tracked tasks, safe to iterate while tasks change. */
    public List<RequestTask> snapshot() {
        return List.copyOf(tasks.values());
    }

    public int activeCount() {
        return tasks.size();
    }

    public RequestStats stats() {
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        long totalCompletionMs = 0;
        List<RequestTask> current = snapshot();
        for (RequestTask task : current) {
            switch (task.getStatus()) {
                case COMPLETED -> {
                    completed++;
                    totalCompletionMs += task.getDuration().map(d -> d.toMillis()).orElse(0L);
                }
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                default -> {
                    // still running
                }
            }
        }
        double avg = completed == 0 ? 0.0 : (double) totalCompletionMs / completed;
        return new RequestStats(totalSubmitted.get(), current.size(), completed, failed, cancelled, avg);
    }
}
