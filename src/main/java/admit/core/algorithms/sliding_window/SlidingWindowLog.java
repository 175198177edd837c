package admit.core.algorithms.sliding_window;

import admit.core.clock.Clock;
import admit.core.clock.SystemClock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;

import java.time.Duration;
import java.util.ArrayDeque;

/**
 * Exact sliding window (log):
 * keeps the timestamp of every admitted request still inside the window, oldest first.
 *
 * Pros: exact, no boundary burst; never more than quota admissions in any window.
 * Cons: O(quota) memory per limiter.
 *
 * Each timestamp is appended once and removed once, so pruning is amortized O(1).
 *
 * Not thread-safe.
 */
public final class SlidingWindowLog implements RateLimiter {
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final Clock clock;
    private final long windowNanos;
    private final int quota;

    private final ArrayDeque<Long> events;

    public SlidingWindowLog(int quota, Duration windowSize) {
        this(SystemClock.instance(), quota, windowSize);
    }

    public SlidingWindowLog(Clock clock, int quota, Duration windowSize) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (quota <= 0) throw new IllegalArgumentException("quota <= 0");
        if (windowSize == null || windowSize.isNegative() || windowSize.isZero()) {
            throw new IllegalArgumentException("window <= 0");
        }
        if (windowSize.compareTo(MAX_NANOS) > 0) throw new IllegalArgumentException("window too large");
        this.clock = clock;
        this.quota = quota;
        this.windowNanos = windowSize.toNanos();
        this.events = new ArrayDeque<>(Math.min(quota, 1024));
    }

    @Override
    public RateLimitResult tryConsume() {
        long now = clock.nowNanos();
        prune(now);

        if (events.size() < quota) {
            events.addLast(now);
            return RateLimitResult.allow();
        }

        long oldest = events.peekFirst();
        return RateLimitResult.reject(windowNanos - (now - oldest));
    }

    // an entry exactly windowNanos old has left the window; compare by difference,
    // nanoTime readings may wrap
    private void prune(long now) {
        while (!events.isEmpty() && now - events.peekFirst() >= windowNanos) {
            events.removeFirst();
        }
    }

    int size() {
        return events.size();
    }
}
