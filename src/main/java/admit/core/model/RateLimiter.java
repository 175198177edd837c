package admit.core.model;

/**
 * Pure core contract: no I/O, no threads.
 *
 * Implementations are plain state machines advanced only by {@link #tryConsume()}.
 * They are NOT thread-safe; callers sharing one instance across threads must serialize
 * access themselves (see {@code SynchronizedRateLimiter} and {@code RateLimiterEngine}).
 */
public interface RateLimiter {

    /**
     * Decides whether one request may proceed now.
     *
     * On ALLOW the consumption is recorded. On REJECT no quota is consumed and
     * {@link RateLimitResult#retryAfterNanos()} holds the suggested wait before retrying.
     */
    RateLimitResult tryConsume();
}
