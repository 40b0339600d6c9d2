package com.phillippitts.modelrelay.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes dispatch executor metrics via Micrometer.
 *
 * <p>POOL mode:
 * <ul>
 *   <li>dispatch.pool.size - Current number of threads in the pool</li>
 *   <li>dispatch.pool.active - Number of threads running provider calls</li>
 *   <li>dispatch.pool.queued - Number of calls waiting in the queue</li>
 *   <li>dispatch.pool.completed - Cumulative count of completed calls</li>
 *   <li>dispatch.pool.max.size - Configured maximum pool size</li>
 * </ul>
 * ASYNC mode reports {@code dispatch.pool.active}, {@code dispatch.pool.queued},
 * {@code dispatch.pool.size} and {@code dispatch.pool.steals} of the work-stealing pool.
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<Executor> dispatchExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("dispatchExecutor") ObjectProvider<Executor> dispatchExecutorProvider) {
        this.dispatchExecutorProvider = dispatchExecutorProvider;
    }

    /**
     * Binds dispatch executor metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers the gauges
     */
    @Bean
    public MeterBinder dispatchExecutorMetrics() {
        return registry -> {
            Executor dispatchExecutor = dispatchExecutorProvider.getObject();
            ThreadPoolExecutor pool = threadPool(dispatchExecutor);
            if (pool != null) {
                Gauge.builder("dispatch.pool.size", pool, ThreadPoolExecutor::getPoolSize)
                        .description("Current number of threads in the dispatch pool")
                        .register(registry);
                Gauge.builder("dispatch.pool.active", pool, ThreadPoolExecutor::getActiveCount)
                        .description("Number of threads running provider calls")
                        .register(registry);
                Gauge.builder("dispatch.pool.queued", pool, e -> e.getQueue().size())
                        .description("Number of provider calls waiting in the queue")
                        .register(registry);
                Gauge.builder("dispatch.pool.completed", pool, ThreadPoolExecutor::getCompletedTaskCount)
                        .description("Cumulative count of completed provider calls")
                        .register(registry);
                Gauge.builder("dispatch.pool.max.size", pool, ThreadPoolExecutor::getMaximumPoolSize)
                        .description("Configured maximum pool size for the dispatch executor")
                        .register(registry);
                LOG.info("Dispatch pool metrics registered: dispatch.pool.*");
                return;
            }
            ForkJoinPool forkJoin = forkJoinPool(dispatchExecutor);
            if (forkJoin != null) {
                Gauge.builder("dispatch.pool.size", forkJoin, ForkJoinPool::getPoolSize)
                        .description("Current number of worker threads")
                        .register(registry);
                Gauge.builder("dispatch.pool.active", forkJoin, ForkJoinPool::getActiveThreadCount)
                        .description("Number of threads running provider calls")
                        .register(registry);
                Gauge.builder("dispatch.pool.queued", forkJoin, ForkJoinPool::getQueuedSubmissionCount)
                        .description("Number of provider calls waiting for a worker")
                        .register(registry);
                Gauge.builder("dispatch.pool.steals", forkJoin, ForkJoinPool::getStealCount)
                        .description("Cumulative count of stolen tasks")
                        .register(registry);
                LOG.info("Work-stealing dispatch metrics registered: dispatch.pool.*");
            }
        };
    }

    /**
     * Logs dispatch pool health every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        Executor dispatchExecutor = dispatchExecutorProvider.getObject();
        ThreadPoolExecutor pool = threadPool(dispatchExecutor);
        if (pool != null) {
            LOG.info("Dispatch pool health: size={}/{}, active={}, queued={}, completed={}",
                    pool.getPoolSize(),
                    pool.getMaximumPoolSize(),
                    pool.getActiveCount(),
                    pool.getQueue().size(),
                    pool.getCompletedTaskCount());
            return;
        }
        ForkJoinPool forkJoin = forkJoinPool(dispatchExecutor);
        if (forkJoin != null) {
            LOG.info("Dispatch pool health: size={}, active={}, queued={}, steals={}",
                    forkJoin.getPoolSize(),
                    forkJoin.getActiveThreadCount(),
                    forkJoin.getQueuedSubmissionCount(),
                    forkJoin.getStealCount());
        }
    }

    static ThreadPoolExecutor threadPool(Executor executor) {
        if (executor instanceof ThreadPoolTaskExecutor taskExecutor) {
            return taskExecutor.getThreadPoolExecutor();
        }
        return null;
    }

    static ForkJoinPool forkJoinPool(Executor executor) {
        if (executor instanceof MdcPropagatingExecutor mdc && mdc.delegate() instanceof ForkJoinPool pool) {
            return pool;
        }
        return null;
    }
}
