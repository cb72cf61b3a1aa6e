package org.smileyface.minespec.fetch;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds the number of requests in flight per domain. Each domain gets its own fair semaphore, kept
 * only while some caller holds or waits for one of its permits.
 */
public class DomainThrottle {

    private final int permitsPerDomain;
    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();

    public DomainThrottle(int permitsPerDomain) {
        if (permitsPerDomain < 1) {
            throw new IllegalArgumentException("permitsPerDomain must be >= 1: " + permitsPerDomain);
        }
        this.permitsPerDomain = permitsPerDomain;
    }

    /**
     * Runs {@code request} while holding a permit for {@code domain}, waiting at most {@code timeoutMs}
     * for one. Callers keep the wait short so that a slow domain cannot park the fetch threads.
     *
     * @throws TransientFetchException when no permit became available in time
     */
    public <T> T withPermit(String domain, long timeoutMs, FetchCall<T> request)
            throws TransientFetchException, InterruptedException {
        String key = domain == null ? "" : domain;
        // users is only touched inside compute, which is atomic per key
        Slot slot = slots.compute(key, (k, s) -> {
            Slot held = s == null ? new Slot(permitsPerDomain) : s;
            held.users++;
            return held;
        });
        try {
            if (!slot.semaphore.tryAcquire(Math.max(0, timeoutMs), TimeUnit.MILLISECONDS)) {
                throw new TransientFetchException("No fetch permit for " + domain + " within " + timeoutMs + " ms",
                        (Integer) null);
            }
            try {
                return request.call();
            } finally {
                slot.semaphore.release();
            }
        } finally {
            slots.computeIfPresent(key, (k, s) -> --s.users == 0 ? null : s);
        }
    }

    /** Permits currently free for the domain. */
    public int available(String domain) {
        Slot slot = slots.get(domain);
        return slot == null ? permitsPerDomain : slot.semaphore.availablePermits();
    }

    /** Number of domains with a caller holding or waiting for a permit. */
    public int activeDomains() {
        return slots.size();
    }

    private static final class Slot {
        final Semaphore semaphore;
        int users;

        Slot(int permits) {
            this.semaphore = new Semaphore(permits, true);
        }
    }

    @FunctionalInterface
    public interface FetchCall<T> {
        T call() throws TransientFetchException;
    }
}
