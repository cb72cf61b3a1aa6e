package org.smileyface.minespec.safety;

import java.util.Optional;

/**
 * Per-origin cache of robots.txt bodies with a time-to-live. Only robots.txt content is cached,
 * never a safety verdict. An empty string stands for "unreadable, allow all".
 */
public interface RobotsCache {

    /**
     * Cached robots.txt body for the origin ({@code scheme://host:port}), empty when absent or expired.
     */
    Optional<String> get(String origin);

    /**
     * Stores the robots.txt body for the origin; the entry expires after the cache's TTL.
     */
    void put(String origin, String robotsTxt);

    /**
     * Drops the entry for the origin so the next lookup fetches robots.txt again.
     */
    void expire(String origin);

    /**
     * Removes every entry.
     */
    void clear();
}
