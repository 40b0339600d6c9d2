package com.phillippitts.modelrelay.config;

import org.apache.logging.log4j.ThreadContext;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Executor wrapper that copies the submitting thread's Log4j2 ThreadContext (MDC) to the
 * thread that runs the task, restoring the worker's own context afterwards.
 */
public final class MdcPropagatingExecutor implements Executor {

    private final Executor delegate;

    public MdcPropagatingExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(wrap(command));
    }

    public Executor delegate() {
        return delegate;
    }

    /**
     * Stops the underlying executor service, if any. Invoked by Spring on context close.
     */
    public void shutdown() {
        if (delegate instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    /**
     * Captures the current ThreadContext and returns a runnable that installs it around {@code runnable}.
     */
    static Runnable wrap(Runnable runnable) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                ThreadContext.clearMap();
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                ThreadContext.clearMap();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
