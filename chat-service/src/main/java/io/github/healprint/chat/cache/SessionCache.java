package io.github.healprint.chat.cache;

import java.time.Duration;

/**
 * String key-value cache with per-entry TTL holding disposable conversation snapshots.
 * Implementations must never throw: an unreachable or disabled backend turns every call into a
 * no-op that reports failure or {@link CacheLookup.Status#DEGRADED}.
 */
public interface SessionCache {

    /** Returns true if the cache backend is configured and was reachable at start-up. */
    boolean available();

    /** Stores {@code value} under {@code key}, returning false if nothing was written. */
    boolean put(String key, String value, Duration ttl);

    CacheLookup get(String key);

    /** Removes {@code key}, returning false if the backend could not be reached. */
    boolean delete(String key);
}
