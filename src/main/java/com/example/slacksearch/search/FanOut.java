package com.example.slacksearch.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs one task per input on a shared pool and joins them all. Each task gets its own timeout,
 * counted from the moment a pool thread picks it up, so time spent queued behind other requests
 * is not charged to it. A task that fails or outlives its timeout yields its fallback value
 * without affecting its siblings. If the joining thread is interrupted (the request went away)
 * every task still in flight is cancelled.
 */
class FanOut {

    private static final Logger logger = LoggerFactory.getLogger(FanOut.class);

    private final ExecutorService executor;
    private final Duration taskTimeout;

    FanOut(ExecutorService executor, Duration taskTimeout) {
        this.executor = executor;
        this.taskTimeout = taskTimeout;
    }

    <T, R> Map<T, R> run(String stage, Collection<T> inputs, Function<T, R> task, Function<T, R> fallback) {
        Map<T, Attempt<R>> attempts = new LinkedHashMap<>();
        for (T input : inputs) {
            Attempt<R> attempt = new Attempt<>();
            attempt.future = executor.submit(() -> {
                attempt.markStarted();
                return task.apply(input);
            });
            attempts.put(input, attempt);
        }

        Map<T, R> results = new LinkedHashMap<>();
        try {
            for (Map.Entry<T, Attempt<R>> entry : attempts.entrySet()) {
                T input = entry.getKey();
                Attempt<R> attempt = entry.getValue();
                try {
                    results.put(input, await(attempt));
                } catch (ExecutionException e) {
                    logger.warn("{} failed for {}: {}", stage, input, String.valueOf(e.getCause()));
                    results.put(input, fallback.apply(input));
                } catch (TimeoutException e) {
                    attempt.future.cancel(true);
                    logger.warn("{} timed out for {} after {}ms", stage, input, taskTimeout.toMillis());
                    results.put(input, fallback.apply(input));
                } catch (CancellationException e) {
                    results.put(input, fallback.apply(input));
                }
            }
        } catch (InterruptedException e) {
            attempts.values().forEach(a -> a.future.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException(stage + " interrupted, " + attempts.size() + " tasks cancelled");
        }
        return results;
    }

    /**
     * Waits for one task. While it is still queued the wait is extended a timeout at a time;
     * once it runs, it times out {@code taskTimeout} after it started.
     */
    private <R> R await(Attempt<R> attempt) throws InterruptedException, ExecutionException, TimeoutException {
        long timeoutNanos = taskTimeout.toNanos();
        while (true) {
            long wait = attempt.started
                    ? attempt.startedAt + timeoutNanos - System.nanoTime()
                    : timeoutNanos;
            try {
                return attempt.future.get(Math.max(0L, wait), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (attempt.started && System.nanoTime() - attempt.startedAt >= timeoutNanos) {
                    throw e;
                }
            }
        }
    }

    private static final class Attempt<R> {
        private Future<R> future;
        private volatile long startedAt;
        private volatile boolean started;

        void markStarted() {
            startedAt = System.nanoTime();
            started = true;
        }
    }
}
