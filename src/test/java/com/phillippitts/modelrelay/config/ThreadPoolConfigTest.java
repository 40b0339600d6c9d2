package com.phillippitts.modelrelay.config;

import com.phillippitts.modelrelay.config.properties.DispatchMode;
import com.phillippitts.modelrelay.config.properties.OrchestratorProperties;
import com.phillippitts.modelrelay.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private Executor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearMap();
        if (executor instanceof ThreadPoolTaskExecutor taskExecutor) {
            taskExecutor.shutdown();
        } else if (executor instanceof MdcPropagatingExecutor mdc) {
            mdc.shutdown();
        }
    }

    private static ThreadPoolConfig config(DispatchMode mode) {
        OrchestratorProperties orchestratorProperties = new OrchestratorProperties();
        orchestratorProperties.setDispatchMode(mode);
        return new ThreadPoolConfig(new ThreadPoolProperties(), orchestratorProperties);
    }

    @Test
    void shouldCreatePoolExecutorWithDefaultSizing() {
        executor = config(DispatchMode.POOL).dispatchExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(8);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(32);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("dispatch-pool-");
    }

    @Test
    void shouldCreateWorkStealingExecutorInAsyncMode() {
        executor = config(DispatchMode.ASYNC).dispatchExecutor();

        assertThat(executor).isInstanceOf(MdcPropagatingExecutor.class);
        assertThat(((MdcPropagatingExecutor) executor).delegate()).isInstanceOf(ForkJoinPool.class);
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        executor = config(DispatchMode.POOL).dispatchExecutor();
        int taskCount = 20;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10); // Simulate a provider round trip
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
    }

    @Test
    void shouldPropagateThreadContextInBothModes() throws InterruptedException {
        for (DispatchMode mode : DispatchMode.values()) {
            executor = config(mode).dispatchExecutor();
            ThreadContext.put("requestTag", "batch-" + mode);
            AtomicReference<String> seen = new AtomicReference<>();
            CountDownLatch latch = new CountDownLatch(1);

            executor.execute(() -> {
                seen.set(ThreadContext.get("requestTag"));
                latch.countDown();
            });

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("batch-" + mode);
            tearDown();
        }
    }

    @Test
    void shouldCreateDeadlineScheduler() {
        ThreadPoolTaskScheduler scheduler = config(DispatchMode.POOL).taskScheduler();
        try {
            assertThat(scheduler.getThreadNamePrefix()).isEqualTo("relay-timeout-");
            assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(4);
        } finally {
            scheduler.shutdown();
        }
    }
}
