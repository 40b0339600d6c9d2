package com.phillippitts.modelrelay.service.dispatch;

import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.service.task.RequestOptions;
import com.phillippitts.modelrelay.service.task.RequestTask;
import com.phillippitts.modelrelay.service.task.TaskKind;
import com.phillippitts.modelrelay.service.task.TaskRegistry;
import com.phillippitts.modelrelay.service.task.TaskResult;
import com.phillippitts.modelrelay.service.task.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TaskTimeoutEnforcerTest {

    private ThreadPoolTaskScheduler scheduler;
    private final TaskRegistry registry = new TaskRegistry();

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("test-timeout-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void shouldFailTaskThatOutlivesItsTimeout() throws Exception {
        TaskTimeoutEnforcer enforcer = new TaskTimeoutEnforcer(scheduler);
        RequestTask task = registry.create(TaskKind.CHAT_COMPLETION, ProviderId.OLLAMA,
                RequestOptions.withTimeout(50), null);
        task.markInProgress();

        enforcer.watch(task);
        RequestTask done = task.completion().get(2, TimeUnit.SECONDS);

        assertThat(done.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(done.getErrorInfo()).contains("Request timed out after 50 ms");
    }

    @Test
    void shouldMeasureDeadlineOnSchedulerClock() throws Exception {
        ThreadPoolTaskScheduler shifted = new ThreadPoolTaskScheduler();
        shifted.setPoolSize(1);
        shifted.setClock(Clock.offset(Clock.systemUTC(), Duration.ofHours(1)));
        shifted.initialize();
        try {
            TaskTimeoutEnforcer enforcer = new TaskTimeoutEnforcer(shifted);
            RequestTask task = registry.create(TaskKind.CHAT_COMPLETION, ProviderId.OLLAMA,
                    RequestOptions.withTimeout(300), null);
            task.markInProgress();

            enforcer.watch(task);
            Thread.sleep(100);
            assertThat(task.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);

            RequestTask done = task.completion().get(2, TimeUnit.SECONDS);
            assertThat(done.getStatus()).isEqualTo(TaskStatus.FAILED);
        } finally {
            shifted.shutdown();
        }
    }

    @Test
    void shouldLeaveTaskFinishedBeforeDeadlineAlone() throws InterruptedException {
        TaskTimeoutEnforcer enforcer = new TaskTimeoutEnforcer(scheduler);
        RequestTask task = registry.create(TaskKind.CHAT_COMPLETION, ProviderId.OLLAMA,
                RequestOptions.withTimeout(50), null);

        enforcer.watch(task);
        task.complete(new TaskResult.ChatCompletion(ChatResponse.of("fast", "llama")));
        Thread.sleep(150);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(scheduler.getScheduledThreadPoolExecutor().getQueue()).isEmpty();
    }

    @Test
    void shouldIgnoreTasksWithoutTimeout() throws InterruptedException {
        TaskTimeoutEnforcer enforcer = new TaskTimeoutEnforcer(scheduler);
        RequestTask task = registry.create(TaskKind.CHAT_COMPLETION, ProviderId.OLLAMA,
                RequestOptions.withTimeout(0), null);

        enforcer.watch(task);
        Thread.sleep(50);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void disabledEnforcerShouldNeverFailTasks() throws InterruptedException {
        TaskTimeoutEnforcer enforcer = TaskTimeoutEnforcer.disabled();
        RequestTask task = registry.create(TaskKind.CHAT_COMPLETION, ProviderId.OLLAMA,
                RequestOptions.withTimeout(10), null);

        enforcer.watch(task);
        Thread.sleep(50);

        assertThat(enforcer.isEnabled()).isFalse();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
    }
}
