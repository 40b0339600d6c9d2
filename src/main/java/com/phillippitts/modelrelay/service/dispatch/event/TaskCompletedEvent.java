package com.phillippitts.modelrelay.service.dispatch.event;

import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.service.task.RequestTask;
import com.phillippitts.modelrelay.service.task.TaskKind;
import com.phillippitts.modelrelay.service.task.TaskStatus;

import java.time.Duration;

/**
 * Published once per task after it reaches a terminal state.
 *
 * <p>Carries technical diagnostics only; message contents are never included.
 *
 * @param durationMs      start-to-completion time
 * @param errorInfo       failure description, null unless {@code status} is FAILED
 * @param servedFromCache true when the result came from the response cache without a provider call
 */
public record TaskCompletedEvent(long taskId,
                                 ProviderId provider,
                                 TaskKind kind,
                                 TaskStatus status,
                                 long durationMs,
                                 String errorInfo,
                                 boolean servedFromCache) {

    public TaskCompletedEvent {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal, got: " + status);
        }
    }

    public static TaskCompletedEvent from(RequestTask task) {
        return new TaskCompletedEvent(
                task.getId(),
                task.getProvider(),
                task.getKind(),
                task.getStatus(),
                task.getDuration().map(Duration::toMillis).orElse(0L),
                task.getErrorInfo().orElse(null),
                task.isServedFromCache());
    }

    public boolean succeeded() {
        return status == TaskStatus.COMPLETED;
    }
}
