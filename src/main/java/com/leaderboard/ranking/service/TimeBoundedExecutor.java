package com.leaderboard.ranking.service;

import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a blocking call under a caller-supplied deadline. A null or non-positive
 * timeout runs the call inline on the caller's thread.
 */
@Component
public class TimeBoundedExecutor {

    private final ExecutorService executor;

    public TimeBoundedExecutor() {
        this(Executors.newCachedThreadPool(daemonThreads()));
    }

    TimeBoundedExecutor(ExecutorService executor) {
        this.executor = executor;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "leaderboard-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * @throws TimeoutException     the deadline passed; the call is cancelled
     * @throws ExecutionException   the call threw; the original exception is the cause
     * @throws InterruptedException the waiting thread was interrupted
     */
    public <T> T call(Callable<T> task, Duration timeout)
            throws TimeoutException, ExecutionException, InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            try {
                return task.call();
            } catch (Exception e) {
                throw new ExecutionException(e);
            }
        }
        Future<T> future = executor.submit(task);
        try {
            // full precision: a sub-millisecond remainder of a shared deadline is still a wait
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
