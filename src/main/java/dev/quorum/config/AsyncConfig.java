package dev.quorum.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Executor for the agent fan-out.
 *
 * <p>Agent calls are I/O-bound (waiting on the model endpoint), so the pool is a
 * cached one: a run submits at most one task per enabled agent plus one per
 * in-flight model call, and idle threads are reclaimed after a minute.
 *
 * <p>Tasks are wrapped with MDC propagation so deliveryId/reviewId survive the
 * hop onto agent threads.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentExecutorService")
    public ExecutorService agentExecutorService() {
        ExecutorService base = Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Copies the caller's MDC onto the worker thread and clears it afterwards.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }

    /**
     * Wraps an ExecutorService to apply MDC propagation to all submitted tasks.
     */
    static class DelegatingExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;
        private final MdcPropagatingTaskDecorator decorator;

        DelegatingExecutorService(ExecutorService delegate, MdcPropagatingTaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}
