package com.phillippitts.modelrelay.service.dispatch;

import com.phillippitts.modelrelay.service.task.RequestTask;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.ScheduledFuture;

/**
 * Fails tasks that are still running when their {@code timeoutMs} elapses.
 *
 * <p>The provider call itself is not interrupted. When it eventually returns, the worker finds
 * the task already FAILED and drops the late result.
 *
 * <p>Deadlines are computed from {@link TaskScheduler#getClock()}, the clock the scheduler
 * triggers against.
 */
public class TaskTimeoutEnforcer {

    private static final Logger LOG = LogManager.getLogger(TaskTimeoutEnforcer.class);

    private static final TaskTimeoutEnforcer DISABLED = new TaskTimeoutEnforcer(null);

    private final TaskScheduler scheduler;

    /**
     * @param scheduler timer source; {@code null} disables enforcement
     */
    public TaskTimeoutEnforcer(TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public static TaskTimeoutEnforcer disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return scheduler != null;
    }

    /**
     * Arms a timer for the task. The timer is cancelled as soon as the task reaches a terminal state.
     */
    public void watch(RequestTask task) {
        long timeoutMs = task.getOptions().timeoutMs();
        if (scheduler == null || timeoutMs <= 0 || task.isTerminal()) {
            return;
        }
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> expire(task, timeoutMs),
                scheduler.getClock().instant().plusMillis(timeoutMs));
        task.completion().whenComplete((t, err) -> timer.cancel(false));
    }

    void expire(RequestTask task, long timeoutMs) {
        if (task.fail("Request timed out after " + timeoutMs + " ms")) {
            LOG.warn("Task {} on {} timed out after {} ms",
                    task.getId(), task.getProvider().displayName(), timeoutMs);
        }
    }
}
