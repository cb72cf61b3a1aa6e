package org.smileyface.minespec.fetch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;

/**
 * Retries a call that fails with {@link TransientFetchException}, with jittered exponential backoff.
 *
 * <p>Attempts run on the given executor; the wait between attempts is a task on the scheduler, so no
 * thread sleeps. The delay before attempt {@code n + 1} is
 * {@code min(maxDelay, baseDelay * 2^(n-1)) * (0.5 + 0.5 * jitter)} with jitter in [0, 1).
 * Cancelling the returned future drops any pending attempt.</p>
 */
public class BackoffRetry {

    private static final Logger log = LogManager.getLogger();

    private final ScheduledExecutorService scheduler;
    private final Executor executor;
    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final DoubleSupplier jitter;

    public BackoffRetry(ScheduledExecutorService scheduler, Executor executor, int maxAttempts,
                        long baseDelayMs, long maxDelayMs) {
        this(scheduler, executor, maxAttempts, baseDelayMs, maxDelayMs, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffRetry(ScheduledExecutorService scheduler, Executor executor, int maxAttempts,
                        long baseDelayMs, long maxDelayMs, DoubleSupplier jitter) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(0, maxDelayMs);
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    public <T> CompletableFuture<T> execute(Callable<T> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicReference<Future<?>> pending = new AtomicReference<>();
        result.whenComplete((v, t) -> {
            Future<?> f = pending.get();
            if (f != null && result.isCancelled()) f.cancel(false);
        });
        submit(call, 1, result, pending);
        return result;
    }

    /** Delay before the attempt following attempt {@code n}. */
    long delayMs(int n) {
        double exp = baseDelayMs * Math.pow(2, Math.max(0, n - 1));
        double capped = Math.min(maxDelayMs, exp);
        double j = Math.max(0.0, Math.min(1.0, jitter.getAsDouble()));
        return Math.round(capped * (0.5 + 0.5 * j));
    }

    private <T> void submit(Callable<T> call, int attempt, CompletableFuture<T> result,
                            AtomicReference<Future<?>> pending) {
        try {
            executor.execute(() -> runAttempt(call, attempt, result, pending));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
    }

    private <T> void runAttempt(Callable<T> call, int attempt, CompletableFuture<T> result,
                                AtomicReference<Future<?>> pending) {
        if (result.isDone()) return;
        try {
            result.complete(call.call());
        } catch (TransientFetchException e) {
            if (attempt >= maxAttempts || result.isDone()) {
                result.completeExceptionally(e);
                return;
            }
            long delay = delayMs(attempt);
            log.debug("Attempt {} of {} failed ({}), retrying in {} ms", attempt, maxAttempts, e.getMessage(), delay);
            try {
                pending.set(scheduler.schedule(() -> submit(call, attempt + 1, result, pending), delay,
                        TimeUnit.MILLISECONDS));
            } catch (RejectedExecutionException rejected) {
                result.completeExceptionally(e);
            }
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
    }
}
