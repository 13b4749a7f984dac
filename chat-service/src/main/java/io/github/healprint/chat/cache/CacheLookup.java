package io.github.healprint.chat.cache;

/**
 * Result of a {@link SessionCache#get} call. {@link Status#DEGRADED} means the cache could not
 * answer (disabled, failing or timed out); callers handle it exactly like a miss.
 */
public record CacheLookup(Status status, String value) {

    public enum Status {
        HIT,
        MISS,
        DEGRADED
    }

    private static final CacheLookup MISS = new CacheLookup(Status.MISS, null);
    private static final CacheLookup DEGRADED = new CacheLookup(Status.DEGRADED, null);

    public static CacheLookup hit(String value) {
        return new CacheLookup(Status.HIT, value);
    }

    public static CacheLookup miss() {
        return MISS;
    }

    public static CacheLookup degraded() {
        return DEGRADED;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }
}
