package fr.lapetina.dispatch.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client token bucket admission gate, evaluated before global admission.
 *
 * Buckets start full. Refill happens in whole elapsed seconds; the sub-second remainder
 * is carried over so frequent checks still refill. A refused check leaves the bucket
 * untouched.
 *
 * Checks for the same key are serialized by {@link ConcurrentHashMap#compute}; checks for
 * different keys proceed in parallel.
 */
public final class DdosShield {

    private static final Logger log = LoggerFactory.getLogger(DdosShield.class);

    public enum Decision {
        OK,
        LIMITED
    }

    /**
     * Immutable bucket state for one client.
     */
    record TokenBucket(long tokens, long lastRefillMillis) {
    }

    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile Limits limits;

    private record Limits(int capacity, int refillPerSecond) {
    }

    public DdosShield(int capacity, int refillPerSecond, Clock clock) {
        this.limits = validated(capacity, refillPerSecond);
        this.clock = clock;
        log.info("DdosShield initialized: capacity={}, refillPerSecond={}", capacity, refillPerSecond);
    }

    public DdosShield(int capacity, int refillPerSecond) {
        this(capacity, refillPerSecond, Clock.systemUTC());
    }

    public DdosShield() {
        this(100, 50);
    }

    /**
     * Consumes one token for the client if one is available.
     */
    public Decision check(String remote) {
        String key = remote != null ? remote : "unknown";
        Limits current = limits;
        long now = clock.millis();
        Decision[] decision = new Decision[1];

        buckets.compute(key, (k, bucket) -> {
            if (bucket == null) {
                bucket = new TokenBucket(current.capacity(), now);
            }
            long elapsedSeconds = Math.max(0, (now - bucket.lastRefillMillis()) / 1000);
            long tokens = Math.min(current.capacity(), bucket.tokens() + elapsedSeconds * current.refillPerSecond());
            if (tokens > 0) {
                decision[0] = Decision.OK;
                long last = elapsedSeconds > 0
                        ? bucket.lastRefillMillis() + elapsedSeconds * 1000
                        : bucket.lastRefillMillis();
                return new TokenBucket(tokens - 1, last);
            }
            decision[0] = Decision.LIMITED;
            return bucket;
        });

        if (decision[0] == Decision.LIMITED) {
            log.debug("Client rate limited: remote={}", key);
        }
        return decision[0];
    }

    /**
     * Changes capacity and refill rate for subsequent checks. Existing buckets are clamped
     * to the new capacity on their next check.
     */
    public void updateLimits(int capacity, int refillPerSecond) {
        Limits old = limits;
        this.limits = validated(capacity, refillPerSecond);
        log.info("DdosShield limits changed: capacity {} -> {}, refillPerSecond {} -> {}",
                old.capacity(), capacity, old.refillPerSecond(), refillPerSecond);
    }

    /**
     * Drops buckets that have been idle long enough to be full again.
     *
     * @return number of buckets removed
     */
    public int purgeIdle() {
        Limits current = limits;
        long now = clock.millis();
        int before = buckets.size();
        buckets.entrySet().removeIf(e -> {
            TokenBucket b = e.getValue();
            long elapsedSeconds = (now - b.lastRefillMillis()) / 1000;
            return b.tokens() + elapsedSeconds * current.refillPerSecond() >= current.capacity();
        });
        int removed = before - buckets.size();
        if (removed > 0) {
            log.debug("Purged idle token buckets: removed={}, remaining={}", removed, buckets.size());
        }
        return removed;
    }

    public int getTrackedClients() {
        return buckets.size();
    }

    public int getCapacity() {
        return limits.capacity();
    }

    public int getRefillPerSecond() {
        return limits.refillPerSecond();
    }

    private static Limits validated(int capacity, int refillPerSecond) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Bucket capacity must be positive: " + capacity);
        }
        if (refillPerSecond < 0) {
            throw new IllegalArgumentException("Refill rate must not be negative: " + refillPerSecond);
        }
        return new Limits(capacity, refillPerSecond);
    }
}
