package admit.core.algorithms.fixed_window;

import admit.core.clock.Clock;
import admit.core.clock.SystemClock;
import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;

import java.time.Duration;

/**
 * Fixed window:
 * counts admissions in consecutive windows of fixed length.
 *
 * The window rolls over lazily: it is restarted at the instant of the first call that
 * finds it expired, so an idle limiter only moves its window when queried again.
 *
 * Pros: O(1) time and memory, trivial to reason about.
 * Cons: a burst straddling a window edge can admit up to 2x quota in less than one
 * window (e.g. quota at the end of window N and quota again at the start of N+1).
 *
 * Not thread-safe.
 */
public final class FixedWindow implements RateLimiter {
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final Clock clock;
    private final long windowNanos;
    private final int quota;

    private long windowStart;
    private int count;

    public FixedWindow(int quota, Duration windowSize) {
        this(SystemClock.instance(), quota, windowSize);
    }

    public FixedWindow(Clock clock, int quota, Duration windowSize) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (quota <= 0) throw new IllegalArgumentException("quota <= 0");
        if (windowSize == null || windowSize.isNegative() || windowSize.isZero()) {
            throw new IllegalArgumentException("window <= 0");
        }
        if (windowSize.compareTo(MAX_NANOS) > 0) throw new IllegalArgumentException("window too large");
        this.clock = clock;
        this.quota = quota;
        this.windowNanos = windowSize.toNanos();

        this.windowStart = clock.nowNanos();
        this.count = 0;
    }

    @Override
    public RateLimitResult tryConsume() {
        long now = clock.nowNanos();
        long elapsed = now - windowStart;
        if (elapsed >= windowNanos) {
            windowStart = now;
            count = 0;
            elapsed = 0;
        }

        if (count < quota) {
            count++;
            return RateLimitResult.allow();
        }

        return RateLimitResult.reject(windowNanos - elapsed);
    }

    int count() {
        return count;
    }
}
