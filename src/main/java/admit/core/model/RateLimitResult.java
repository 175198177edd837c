package admit.core.model;

import java.time.Duration;

/**
 * Outcome of a single admission decision.
 * retryAfterNanos is 0 on ALLOW and never negative on REJECT.
 */
public record RateLimitResult(
    Decision decision,
    long retryAfterNanos
) {
    private static final RateLimitResult ALLOWED = new RateLimitResult(Decision.ALLOW, 0L);

    public static RateLimitResult allow() {
        return ALLOWED;
    }

    public static RateLimitResult reject(long retryAfterNanos) {
        return new RateLimitResult(Decision.REJECT, Math.max(0L, retryAfterNanos));
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }

    public Duration retryAfter() {
        return Duration.ofNanos(retryAfterNanos);
    }
}
