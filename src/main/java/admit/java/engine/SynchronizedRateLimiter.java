package admit.java.engine;

import admit.core.model.RateLimitResult;
import admit.core.model.RateLimiter;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe decorator around a single core limiter.
 *
 * Core limiters carry no synchronization; this wrapper serializes every decision on one
 * ReentrantLock so a single limiter can be shared by many request threads.
 */
public final class SynchronizedRateLimiter implements RateLimiter {

    private final RateLimiter delegate;
    private final ReentrantLock lock = new ReentrantLock();

    public SynchronizedRateLimiter(RateLimiter delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (delegate instanceof SynchronizedRateLimiter) {
            throw new IllegalArgumentException("delegate is already synchronized");
        }
        this.delegate = delegate;
    }

    @Override
    public RateLimitResult tryConsume() {
        lock.lock();
        try {
            return delegate.tryConsume();
        } finally {
            lock.unlock();
        }
    }
}
