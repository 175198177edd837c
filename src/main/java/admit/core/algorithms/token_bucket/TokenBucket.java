package admit.core.algorithms.token_bucket;

import admit.core.clock.Clock;
import admit.core.clock.SystemClock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;

import java.time.Duration;

/**
 * Token Bucket:
 * - capacity: max tokens, the bucket starts full
 * - refillInterval: one token is added per whole interval elapsed
 *
 * Refill is discrete. The anchor (lastRefill) only moves by whole intervals, so the
 * fractional remainder of elapsed time is carried into the next call and the refill
 * schedule does not drift with call frequency.
 *
 * Pros: O(1) time and memory, absorbs bursts up to capacity with a steady mean rate.
 * Cons: capacity and interval are hard to tune for variable load.
 *
 * Not thread-safe.
 */
public final class TokenBucket implements RateLimiter {
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final Clock clock;
    private final int capacity;
    private final long refillNanos;

    private int tokens;
    private long lastRefill;

    public TokenBucket(int capacity, Duration refillInterval) {
        this(SystemClock.instance(), capacity, refillInterval);
    }

    public TokenBucket(Clock clock, int capacity, Duration refillInterval) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (refillInterval == null || refillInterval.isNegative() || refillInterval.isZero()) {
            throw new IllegalArgumentException("refill <= 0");
        }
        if (refillInterval.compareTo(MAX_NANOS) > 0) throw new IllegalArgumentException("refill too large");
        this.clock = clock;
        this.capacity = capacity;
        this.refillNanos = refillInterval.toNanos();

        this.tokens = capacity;
        this.lastRefill = clock.nowNanos();
    }

    @Override
    public RateLimitResult tryConsume() {
        long now = clock.nowNanos();
        refill(now);

        if (tokens > 0) {
            tokens--;
            return RateLimitResult.allow();
        }

        return RateLimitResult.reject(refillNanos - (now - lastRefill));
    }

    private void refill(long now) {
        long intervals = (now - lastRefill) / refillNanos;
        if (intervals <= 0) return;

        // a full bucket gains nothing, but the anchor still follows the clock
        if (tokens < capacity) {
            tokens = (int) Math.min(capacity, tokens + intervals);
        }
        lastRefill += intervals * refillNanos;
    }

    int availableTokens() {
        return tokens;
    }
}
