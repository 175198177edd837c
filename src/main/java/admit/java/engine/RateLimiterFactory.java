package admit.java.engine;

import admit.core.algorithms.fixed_window.FixedWindow;
import admit.core.algorithms.sliding_window.SlidingWindowLog;
import admit.core.algorithms.token_bucket.TokenBucket;
import admit.core.clock.Clock;
import admit.core.model.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating RateLimiter instances based on configuration.
 *
 * Callers can swap algorithms through {@link RateLimiterConfig} without touching the
 * code that calls {@link RateLimiter#tryConsume()}.
 *
 * Thread-safety: This class is stateless and thread-safe.
 */
public final class RateLimiterFactory {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterFactory.class);

    private RateLimiterFactory() {
        // Utility class, no instantiation
    }

    /**
     * Creates a RateLimiter instance based on the provided configuration.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param config Configuration specifying algorithm and parameters
     * @return A new, non-thread-safe RateLimiter instance
     * @throws IllegalArgumentException if clock or config is null
     */
    public static RateLimiter create(Clock clock, RateLimiterConfig config) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");

        RateLimiter limiter = switch (config.algorithmType()) {
            case FIXED_WINDOW -> new FixedWindow(clock, config.limit(), config.period());
            case TOKEN_BUCKET -> new TokenBucket(clock, config.limit(), config.period());
            case SLIDING_WINDOW_LOG -> new SlidingWindowLog(clock, config.limit(), config.period());
        };
        log.debug("Created {} limiter: limit={}, period={}",
            config.algorithmType(), config.limit(), config.period());
        return limiter;
    }
}
