package admit.core.clock;

/**
 * Real system clock - uses System.nanoTime().
 * Immune to wall-clock adjustments; use this in production.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
