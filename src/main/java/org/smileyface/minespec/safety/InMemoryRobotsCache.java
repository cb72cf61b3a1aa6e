package org.smileyface.minespec.safety;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link RobotsCache} on a {@link ConcurrentHashMap}. Expiry is evaluated lazily on read
 * against the injected {@link Clock}.
 */
public class InMemoryRobotsCache implements RobotsCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryRobotsCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    @Override
    public Optional<String> get(String origin) {
        if (origin == null) return Optional.empty();
        Entry e = entries.get(origin);
        if (e == null) return Optional.empty();
        if (!clock.instant().isBefore(e.expiresAt)) {
            entries.remove(origin, e);
            return Optional.empty();
        }
        return Optional.of(e.body);
    }

    @Override
    public void put(String origin, String robotsTxt) {
        if (origin == null || origin.isBlank()) return;
        entries.put(origin, new Entry(robotsTxt == null ? "" : robotsTxt, clock.instant().plus(ttl)));
    }

    @Override
    public void expire(String origin) {
        if (origin != null) entries.remove(origin);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    private record Entry(String body, Instant expiresAt) {
    }
}
