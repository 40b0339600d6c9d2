package com.phillippitts.modelrelay.service.task;

/**
 * Point-in-time counters over the task registry.
 *
 * @param totalSubmitted      tasks ever created, including removed ones
 * @param active              tasks currently tracked by the registry
 * @param completed           tracked tasks in {@link TaskStatus#COMPLETED}
 * @param failed              tracked tasks in {@link TaskStatus#FAILED}
 * @param cancelled           tracked tasks in {@link TaskStatus#CANCELLED}
 * @param avgCompletionTimeMs mean start-to-completion time of completed tasks, 0 when none
 */
public record RequestStats(long totalSubmitted,
                           int active,
                           int completed,
                           int failed,
                           int cancelled,
                           double avgCompletionTimeMs) {
}
