package com.phillippitts.modelrelay.service.dispatch;

import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.ProviderId;
import com.phillippitts.modelrelay.exception.ProviderException;
import com.phillippitts.modelrelay.service.task.RequestTask;
import com.phillippitts.modelrelay.service.task.TaskKind;
import com.phillippitts.modelrelay.service.task.TaskRegistry;
import com.phillippitts.modelrelay.service.task.TaskResult;
import com.phillippitts.modelrelay.service.task.TaskStatus;
import com.phillippitts.modelrelay.testutil.SyncExecutor;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.Test;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatchWorkerTest {

    private final TaskRegistry registry = new TaskRegistry();
    private final DispatchWorker worker = new DispatchWorker(new SyncExecutor());

    private RequestTask newTask(TaskKind kind) {
        return registry.create(kind, ProviderId.OPENAI, null, null);
    }

    private static TaskResult chat(String content) {
        return new TaskResult.ChatCompletion(ChatResponse.of(content, "gpt"));
    }

    @Test
    void shouldCompleteTaskWithCallResult() {
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);

        worker.dispatch(task, () -> chat("hello"));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getResult()).contains(chat("hello"));
    }

    @Test
    void shouldFailTaskWithKindSpecificMessage() {
        RequestTask chatTask = newTask(TaskKind.CHAT_COMPLETION);
        RequestTask analysisTask = newTask(TaskKind.CODE_ANALYSIS);

        worker.dispatch(chatTask, () -> {
            throw new IllegalStateException("boom");
        });
        worker.dispatch(analysisTask, () -> {
            throw new ProviderException(ProviderId.CLAUDE, "quota");
        });

        assertThat(chatTask.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(chatTask.getErrorInfo()).contains("Chat completion failed: boom");
        assertThat(analysisTask.getErrorInfo()).contains("Code analysis failed: quota (provider: claude)");
    }

    @Test
    void shouldUseExceptionTypeWhenMessageMissing() {
        RequestTask task = newTask(TaskKind.CODE_EXPLANATION);

        worker.dispatch(task, () -> {
            throw new NullPointerException();
        });

        assertThat(task.getErrorInfo()).contains("Code explanation failed: NullPointerException");
    }

    @Test
    void shouldTruncateLongErrorMessages() {
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);
        String longMessage = "x".repeat(1_000);

        worker.dispatch(task, () -> {
            throw new IllegalStateException(longMessage);
        });

        assertThat(task.getErrorInfo().orElseThrow()).hasSizeLessThan(300).endsWith("...");
    }

    @Test
    void shouldFailWhenCallReturnsNull() {
        RequestTask task = newTask(TaskKind.CODE_COMPLETION);

        worker.dispatch(task, () -> null);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorInfo()).contains("Code completion failed: provider returned no result");
    }

    @Test
    void shouldSkipCallWhenCancelledBeforeRunning() {
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);
        task.cancel();
        AtomicBoolean invoked = new AtomicBoolean();

        worker.dispatch(task, () -> {
            invoked.set(true);
            return chat("never");
        });

        assertThat(invoked).isFalse();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.CANCELLED);
    }

    @Test
    void shouldDiscardResultArrivingAfterCancel() {
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);

        worker.dispatch(task, () -> {
            task.cancel();
            return chat("too late");
        });

        assertThat(task.getStatus()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(task.getResult()).isEmpty();
    }

    @Test
    void shouldFailTaskWhenExecutorRejects() {
        DispatchWorker rejecting = new DispatchWorker(command -> {
            throw new RejectedExecutionException("pool closed");
        });
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);

        rejecting.dispatch(task, () -> chat("never"));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorInfo()).contains("Dispatch rejected: pool closed");
    }

    @Test
    void shouldExposeTaskAndProviderInThreadContextDuringCall() {
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);
        AtomicReference<String> taskId = new AtomicReference<>();
        AtomicReference<String> provider = new AtomicReference<>();

        worker.dispatch(task, () -> {
            taskId.set(ThreadContext.get(DispatchWorker.MDC_TASK_ID));
            provider.set(ThreadContext.get(DispatchWorker.MDC_PROVIDER));
            return chat("ok");
        });

        assertThat(taskId.get()).isEqualTo(String.valueOf(task.getId()));
        assertThat(provider.get()).isEqualTo("openai");
        assertThat(ThreadContext.get(DispatchWorker.MDC_TASK_ID)).isNull();
    }

    @Test
    void shouldFailTaskWhenCallThrowsLinkageError() {
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);

        worker.dispatch(task, () -> {
            throw new NoClassDefFoundError("com/vendor/sdk/Client");
        });

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorInfo().orElseThrow())
                .startsWith("Chat completion failed: NoClassDefFoundError")
                .contains("com/vendor/sdk/Client");
        assertThat(task.completion()).isCompleted();
    }

    @Test
    void shouldFailTaskBeforeRethrowingVirtualMachineError() {
        RequestTask task = newTask(TaskKind.CODE_ANALYSIS);
        AtomicInteger finished = new AtomicInteger();

        assertThatThrownBy(() -> worker.dispatch(task, () -> {
            throw new StackOverflowError();
        }, finished::incrementAndGet)).isInstanceOf(StackOverflowError.class);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorInfo()).isEqualTo("Code analysis failed: StackOverflowError");
        assertThat(finished).hasValue(1);
    }

    @Test
    void shouldRunFinishedHookOnlyAfterCallReturnsEvenWhenTaskEndedEarlier() {
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);
        AtomicBoolean hookRanDuringCall = new AtomicBoolean();
        AtomicInteger finished = new AtomicInteger();

        worker.dispatch(task, () -> {
            task.fail("Request timed out after 50 ms");
            hookRanDuringCall.set(finished.get() > 0);
            return chat("late");
        }, finished::incrementAndGet);

        assertThat(hookRanDuringCall).isFalse();
        assertThat(finished).hasValue(1);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void shouldRunFinishedHookWhenTaskCancelledWhileQueued() {
        RequestTask task = newTask(TaskKind.CHAT_COMPLETION);
        task.cancel();
        AtomicBoolean called = new AtomicBoolean();
        AtomicInteger finished = new AtomicInteger();

        worker.dispatch(task, () -> {
            called.set(true);
            return chat("never");
        }, finished::incrementAndGet);

        assertThat(called).isFalse();
        assertThat(finished).hasValue(1);
    }

    @Test
    void shouldRunFinishedHookWhenExecutorRejects() {
        DispatchWorker rejecting = new DispatchWorker(command -> {
            throw new RejectedExecutionException("pool closed");
        });
        AtomicInteger finished = new AtomicInteger();

        rejecting.dispatch(newTask(TaskKind.CHAT_COMPLETION), () -> chat("never"), finished::incrementAndGet);

        assertThat(finished).hasValue(1);
    }
}
