package com.phillippitts.modelrelay.config;

import com.phillippitts.modelrelay.config.properties.DispatchMode;
import com.phillippitts.modelrelay.config.properties.OrchestratorProperties;
import com.phillippitts.modelrelay.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors that run provider calls and fire request deadlines.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties}; the dispatch backend is
 * selected with {@code relay.orchestrator.dispatch-mode}.
 */
@Configuration
public class ThreadPoolConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolConfig.class);

    private final ThreadPoolProperties threadPoolProperties;
    private final OrchestratorProperties orchestratorProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties,
                            OrchestratorProperties orchestratorProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.orchestratorProperties = orchestratorProperties;
    }

    /**
     * Creates the executor for provider calls.
     *
     * <p>POOL mode, configured via {@code threadpool.dispatch.*}:
     * <ul>
     *   <li>Core pool: default 8 - provider calls are I/O bound</li>
     *   <li>Max pool: default 32 - handles race and broadcast fan-out</li>
     *   <li>Queue: default 200 tasks - prevents unbounded memory growth</li>
     * </ul>
     * When the pool and queue are full, the submitting thread runs the call
     * ({@link ThreadPoolExecutor.CallerRunsPolicy}), providing backpressure instead of failing.
     *
     * <p>ASYNC mode uses a work-stealing pool sized to the available processors.
     *
     * <p>Both backends copy the Log4j2 ThreadContext (MDC) from the submitting thread to the worker.
     *
     * @return executor for provider calls
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        DispatchMode mode = orchestratorProperties.getDispatchMode();
        if (mode == DispatchMode.ASYNC) {
            int parallelism = Runtime.getRuntime().availableProcessors();
            LOG.info("Dispatch mode ASYNC: work-stealing pool, parallelism={}", parallelism);
            return new MdcPropagatingExecutor(new ForkJoinPool(
                    parallelism, ForkJoinPool.defaultForkJoinWorkerThreadFactory, null, true));
        }

        ThreadPoolProperties.DispatchPoolProperties props = threadPoolProperties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(MdcPropagatingExecutor::wrap);
        executor.initialize();
        LOG.info("Dispatch mode POOL: core={}, max={}, queue={}",
                props.getCorePoolSize(), props.getMaxPoolSize(), props.getQueueCapacity());
        return executor;
    }

    /**
     * Scheduler for request deadlines and the application's {@code @Scheduled} jobs.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
