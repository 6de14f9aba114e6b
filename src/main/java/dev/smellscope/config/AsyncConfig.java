package dev.smellscope.config;

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
 * Executor for the detector fan-out.
 *
 * <p>Detector calls block on outbound HTTP, so the pool is unbounded and
 * threads are reclaimed when idle. Tasks are wrapped with MDC propagation so
 * the request id set by the correlation filter survives the hop onto the
 * detector thread.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "detectorExecutorService")
    public ExecutorService detectorExecutorService() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("detector-");
        threadFactory.setDaemon(true);
        return new RequestContextExecutorService(Executors.newCachedThreadPool(threadFactory),
                new RequestContextDecorator());
    }

    /**
     * Runs a detector call under the MDC of the request that submitted it.
     * Pool threads are reused across requests, so the worker's own MDC is put
     * back once the call returns.
     */
    static class RequestContextDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable detectorCall) {
            Map<String, String> requestContext = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> workerContext = MDC.getCopyOfContextMap();
                setContext(requestContext);
                try {
                    detectorCall.run();
                } finally {
                    setContext(workerContext);
                }
            };
        }

        private static void setContext(Map<String, String> context) {
            if (context == null) MDC.clear();
            else MDC.setContextMap(context);
        }
    }

    /**
     * Detector executor facade: every task, including those handed in via
     * submit, passes through the decorator before reaching the pool.
     */
    static class RequestContextExecutorService extends AbstractExecutorService {
        private final ExecutorService pool;
        private final TaskDecorator decorator;

        RequestContextExecutorService(ExecutorService pool, TaskDecorator decorator) {
            this.pool = pool;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            pool.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { pool.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return pool.shutdownNow(); }
        @Override public boolean isShutdown() { return pool.isShutdown(); }
        @Override public boolean isTerminated() { return pool.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return pool.awaitTermination(timeout, unit); }
    }
}
