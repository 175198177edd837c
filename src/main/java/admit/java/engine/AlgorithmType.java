package admit.java.engine;

/**
 * Supported rate limiting algorithms.
 *
 * Each enum defines the algorithm characteristics and trade-offs:
 * - FIXED_WINDOW: Lazy reset, has boundary problem, O(1) time/memory
 * - TOKEN_BUCKET: Discrete refill, burst-friendly, O(1) time/memory
 * - SLIDING_WINDOW_LOG: Exact precision, no boundary problem, O(limit) memory
 */
public enum AlgorithmType {
    /**
     * Fixed Window: counter reset when the current window has expired.
     * Best for: Simple cases where 2x rate spike is acceptable.
     * Memory: O(1) per key
     * Precision: Poor (boundary problem allows 2x rate at boundaries)
     */
    FIXED_WINDOW,

    /**
     * Token Bucket: one token added per elapsed refill interval.
     * Best for: Most use cases requiring burst capacity.
     * Memory: O(1) per key
     * Precision: Good (steady mean rate)
     */
    TOKEN_BUCKET,

    /**
     * Sliding Window Log: Exact tracking with timestamp log.
     * Best for: High precision requirements, acceptable memory cost.
     * Memory: O(limit) per key
     * Precision: Exact (no boundary problem)
     */
    SLIDING_WINDOW_LOG
}
