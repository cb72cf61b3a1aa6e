package org.smileyface.minespec.fetch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRetryTest {

    private ScheduledExecutorService scheduler;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        pool.shutdownNow();
    }

    @Test
    void delaysDoubleUpToTheCap() {
        BackoffRetry full = new BackoffRetry(scheduler, pool, 5, 100, 1000, () -> 1.0);
        assertThat(full.delayMs(1)).isEqualTo(100);
        assertThat(full.delayMs(2)).isEqualTo(200);
        assertThat(full.delayMs(3)).isEqualTo(400);
        assertThat(full.delayMs(4)).isEqualTo(800);
        assertThat(full.delayMs(5)).isEqualTo(1000);

        BackoffRetry half = new BackoffRetry(scheduler, pool, 5, 100, 1000, () -> 0.0);
        assertThat(half.delayMs(1)).isEqualTo(50);
        assertThat(half.delayMs(6)).isEqualTo(500);
    }

    @Test
    void succeedsAfterTransientFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        BackoffRetry retry = new BackoffRetry(scheduler, pool, 3, 5, 20);

        String result = retry.execute(() -> {
            if (calls.incrementAndGet() < 3) throw new TransientFetchException("busy", 503);
            return "done";
        }).get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("done");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        BackoffRetry retry = new BackoffRetry(scheduler, pool, 2, 5, 20);

        CompletableFuture<String> f = retry.execute(() -> {
            calls.incrementAndGet();
            throw new TransientFetchException("busy", 503);
        });

        assertThatThrownBy(() -> f.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TransientFetchException.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void otherFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        BackoffRetry retry = new BackoffRetry(scheduler, pool, 5, 5, 20);

        CompletableFuture<String> f = retry.execute(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("broken");
        });

        assertThatThrownBy(() -> f.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void cancellingStopsFurtherAttempts() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        BackoffRetry retry = new BackoffRetry(scheduler, pool, 5, 300, 300, () -> 1.0);

        CompletableFuture<String> f = retry.execute(() -> {
            calls.incrementAndGet();
            throw new TransientFetchException("busy", 503);
        });
        Thread.sleep(100);
        f.cancel(true);
        Thread.sleep(500);

        assertThat(f.isCancelled()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
    }
}
