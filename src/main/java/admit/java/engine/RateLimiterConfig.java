package admit.java.engine;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for creating a RateLimiter instance.
 *
 * This record encapsulates all parameters needed to instantiate
 * any of the supported rate limiting algorithms.
 *
 * @param algorithmType The algorithm to use
 * @param limit Quota per window (windows) or bucket capacity (TOKEN_BUCKET)
 * @param period Window size (windows) or refill interval (TOKEN_BUCKET)
 */
public record RateLimiterConfig(
    AlgorithmType algorithmType,
    int limit,
    Duration period
) {
    public RateLimiterConfig {
        if (algorithmType == null) throw new IllegalArgumentException("algorithmType cannot be null");
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        if (period == null || period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be > 0");
        }
    }

    /**
     * Creates a Fixed Window configuration.
     *
     * @param limit Maximum requests per window
     * @param windowSize Window length
     * @return Configuration for Fixed Window
     */
    public static RateLimiterConfig fixedWindow(int limit, Duration windowSize) {
        return new RateLimiterConfig(AlgorithmType.FIXED_WINDOW, limit, windowSize);
    }

    /**
     * Creates a Token Bucket configuration.
     *
     * @param capacity Maximum tokens (burst size)
     * @param refillInterval Time between two added tokens
     * @return Configuration for Token Bucket
     */
    public static RateLimiterConfig tokenBucket(int capacity, Duration refillInterval) {
        return new RateLimiterConfig(AlgorithmType.TOKEN_BUCKET, capacity, refillInterval);
    }

    /**
     * Creates a Sliding Window Log configuration.
     *
     * @param limit Maximum requests in any window
     * @param windowSize Window length
     * @return Configuration for Sliding Window Log
     */
    public static RateLimiterConfig slidingWindowLog(int limit, Duration windowSize) {
        return new RateLimiterConfig(AlgorithmType.SLIDING_WINDOW_LOG, limit, windowSize);
    }

    /**
     * Reads a configuration from {@code <prefix>.algorithm}, {@code <prefix>.limit} and
     * {@code <prefix>.period}. The algorithm is matched case-insensitively against
     * {@link AlgorithmType}; the period is an ISO-8601 duration such as {@code PT1S}.
     *
     * @throws IllegalArgumentException if a property is missing or malformed
     */
    public static RateLimiterConfig fromProperties(Properties props, String prefix) {
        if (props == null) throw new IllegalArgumentException("props cannot be null");
        if (prefix == null) throw new IllegalArgumentException("prefix cannot be null");

        String algorithm = required(props, prefix + ".algorithm");
        String limit = required(props, prefix + ".limit");
        String period = required(props, prefix + ".period");

        AlgorithmType type;
        try {
            type = AlgorithmType.valueOf(algorithm.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown algorithm: " + algorithm, e);
        }

        int parsedLimit;
        try {
            parsedLimit = Integer.parseInt(limit);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + prefix + ".limit: " + limit, e);
        }

        Duration parsedPeriod;
        try {
            parsedPeriod = Duration.parse(period);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid " + prefix + ".period: " + period, e);
        }

        return new RateLimiterConfig(type, parsedLimit, parsedPeriod);
    }

    private static String required(Properties props, String name) {
        String value = props.getProperty(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing property: " + name);
        }
        return value.trim();
    }
}
