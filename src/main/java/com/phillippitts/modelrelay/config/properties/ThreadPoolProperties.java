package com.phillippitts.modelrelay.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>{@code threadpool.dispatch.*} sizes the provider call pool used in POOL dispatch mode;
 * {@code threadpool.scheduler.*} sizes the scheduler that fires request deadlines.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private DispatchPoolProperties dispatch = new DispatchPoolProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    public DispatchPoolProperties getDispatch() {
        return dispatch;
    }

    public void setDispatch(DispatchPoolProperties dispatch) {
        this.dispatch = dispatch;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Provider call pool configuration. Calls are I/O bound, so the pool is wider than the CPU count.
     */
    public static class DispatchPoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 200;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "dispatch-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Deadline scheduler configuration.
     */
    public static class SchedulerProperties {
        private int poolSize = 4;
        private String threadNamePrefix = "relay-timeout-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
