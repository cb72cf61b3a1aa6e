package org.smileyface.minespec.safety;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed {@link RobotsCache} shared by every harvester instance.
 *
 * Each origin is a string key "{ns}:{origin}" holding the robots.txt body; the TTL is enforced by
 * Redis key expiry.
 */
public class RedisRobotsCache implements RobotsCache {

    private static final Logger log = LoggerFactory.getLogger(RedisRobotsCache.class);

    private final StringRedisTemplate redis;
    private final String namespace;
    private final Duration ttl;

    public RedisRobotsCache(StringRedisTemplate redisTemplate, String namespace, Duration ttl) {
        this.redis = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    @Override
    public Optional<String> get(String origin) {
        if (origin == null) return Optional.empty();
        return Optional.ofNullable(redis.opsForValue().get(key(origin)));
    }

    @Override
    public void put(String origin, String robotsTxt) {
        if (origin == null || origin.isBlank()) return;
        redis.opsForValue().set(key(origin), robotsTxt == null ? "" : robotsTxt, ttl);
    }

    @Override
    public void expire(String origin) {
        if (origin != null) redis.delete(key(origin));
    }

    @Override
    public void clear() {
        Set<String> keys = redis.keys(namespace + ":*");
        if (keys != null && !keys.isEmpty()) {
            Long removed = redis.delete(keys);
            log.debug("Cleared {} robots entries under {}", removed, namespace);
        }
    }

    private String key(String origin) {
        return namespace + ":" + origin;
    }
}
