package com.phillippitts.modelrelay.service.task;

/**
 * Lifecycle of a {@link RequestTask}.
 *
 * <pre>
 * PENDING -> IN_PROGRESS -> COMPLETED | FAILED | CANCELLED
 * PENDING -> CANCELLED | FAILED
 * </pre>
 * Terminal states are absorbing.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
