package com.phillippitts.modelrelay.config.properties;

/**
 * Executor backend for provider calls.
 */
public enum DispatchMode {
    /** Bounded {@code ThreadPoolTaskExecutor} sized by {@code threadpool.dispatch.*}. */
    POOL,
    /** Work-stealing fork/join pool sized to the available processors. */
    ASYNC
}
