package admit.java.engine;

import admit.core.clock.Clock;
import admit.core.model.RateLimitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe admission control with one independent limiter per key.
 *
 * This is the embedding layer for the core algorithms, which are plain non-thread-safe
 * state machines:
 * - Each key (user, API key, client address...) lazily gets its own limiter built by
 *   {@link RateLimiterFactory} from the default configuration
 * - Each limiter is wrapped in its own {@link SynchronizedRateLimiter}, so contention only
 *   happens on the same key
 * - An LRU bound caps memory; an evicted key starts over with a fresh limiter on its next request
 *
 * Usage example:
 * <pre>
 * RateLimiterConfig config = RateLimiterConfig.tokenBucket(100, Duration.ofMillis(100));
 * RateLimiterEngine engine = new RateLimiterEngine(SystemClock.instance(), config, 10_000);
 *
 * RateLimitResult result = engine.tryConsume("user:123");
 * if (result.allowed()) {
 *     // Process request
 * } else {
 *     // Reject with retry-after: result.retryAfter()
 * }
 * </pre>
 */
public final class RateLimiterEngine {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterEngine.class);

    private final Clock clock;
    private final RateLimiterConfig defaultConfig;
    private final LRUCache<String, SynchronizedRateLimiter> limiters;

    /**
     * Creates a new engine.
     *
     * @param clock Clock instance shared by every limiter (injected for testability)
     * @param defaultConfig Configuration used for every new key
     * @param maxKeys Maximum number of keys to track (LRU eviction beyond this)
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public RateLimiterEngine(Clock clock, RateLimiterConfig defaultConfig, int maxKeys) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be > 0");
        }

        this.clock = clock;
        this.defaultConfig = defaultConfig;
        this.limiters = new LRUCache<>(maxKeys,
            (key, limiter) -> log.debug("Evicted limiter for key={}", key));

        log.info("RateLimiterEngine initialized: algorithm={}, limit={}, period={}, maxKeys={}",
            defaultConfig.algorithmType(), defaultConfig.limit(), defaultConfig.period(), maxKeys);
    }

    /**
     * Decides whether one request for the key may proceed.
     *
     * Thread-safety: Safe for concurrent access from multiple threads.
     *
     * @param key The key to rate limit (e.g., user ID, API key)
     * @return ALLOW, or REJECT with the suggested retry delay
     * @throws IllegalArgumentException if key is null
     */
    public RateLimitResult tryConsume(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        return limiters.getOrCreate(key, this::newLimiter).tryConsume();
    }

    private SynchronizedRateLimiter newLimiter(String key) {
        log.debug("Creating limiter for key={}", key);
        return new SynchronizedRateLimiter(RateLimiterFactory.create(clock, defaultConfig));
    }

    /**
     * @return true if the key currently has a limiter
     */
    public boolean isTracked(String key) {
        return limiters.containsKey(key);
    }

    /**
     * @return Number of keys currently tracked
     */
    public int size() {
        return limiters.size();
    }

    /**
     * @return Maximum number of keys that can be tracked
     */
    public int maxSize() {
        return limiters.maxSize();
    }

    /**
     * Drops every limiter; subsequent requests start with fresh state.
     */
    public void clear() {
        limiters.clear();
    }

    public RateLimiterConfig getDefaultConfig() {
        return defaultConfig;
    }
}
