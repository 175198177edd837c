package admit.core.clock;

/**
 * Monotonic time source. Readings are only meaningful relative to each other.
 */
public interface Clock {
    long nowNanos();
}
