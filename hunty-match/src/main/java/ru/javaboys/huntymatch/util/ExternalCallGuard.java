package ru.javaboys.huntymatch.util;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import ru.javaboys.huntymatch.exception.MatchingException;
import ru.javaboys.huntymatch.exception.ServiceUnavailableException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs blocking calls to external services with an upper time bound.
 * Any failure comes back as {@link ServiceUnavailableException}; MDC is carried over to the worker.
 * At most {@code maxConcurrentCalls} calls run at once; a further call waits for a free slot
 * no longer than its own timeout and is refused after that.
 */
@Slf4j
public class ExternalCallGuard {

    public static final int DEFAULT_MAX_CONCURRENT_CALLS = 16;

    private final ThreadPoolExecutor executor;
    private final Semaphore permits;
    private final int maxConcurrentCalls;

    public ExternalCallGuard() {
        this(DEFAULT_MAX_CONCURRENT_CALLS);
    }

    public ExternalCallGuard(int maxConcurrentCalls) {
        this.maxConcurrentCalls = Math.max(1, maxConcurrentCalls);
        this.permits = new Semaphore(this.maxConcurrentCalls);
        AtomicInteger n = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(this.maxConcurrentCalls, this.maxConcurrentCalls,
                60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, "external-call-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor.allowCoreThreadTimeOut(true);
    }

    public <T> T call(String service, Duration timeout, Supplier<T> call) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        acquireSlot(service, timeout);
        FutureTask<T> future = new FutureTask<>(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return call.get();
            } finally {
                MDC.clear();
            }
        }) {
            @Override
            protected void done() {
                // runs once, on completion or cancel
                permits.release();
            }
        };
        try {
            executor.execute(future);
        } catch (RejectedExecutionException e) {
            permits.release();
            throw new ServiceUnavailableException(service, "guard is shut down", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // interrupts the worker
            future.cancel(true);
            throw new ServiceUnavailableException(service, "no answer within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException(service, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof MatchingException me) {
                throw me;
            }
            throw new ServiceUnavailableException(service, String.valueOf(cause.getMessage()), cause);
        }
    }

    private void acquireSlot(String service, Duration timeout) {
        try {
            if (!permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{}: {} calls already in flight, refusing another", service, maxConcurrentCalls);
                throw new ServiceUnavailableException(service, "too many calls in flight");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException(service, "interrupted", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
