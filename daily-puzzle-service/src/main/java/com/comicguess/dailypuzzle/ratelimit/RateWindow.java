package com.comicguess.dailypuzzle.ratelimit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window log of admitted request times for one key. Holds at most {@code maxRequests}
 * timestamps, all newer than {@code now - window}.
 * <p>
 * A window is retired once the registry drops it; a retired window admits nothing and callers
 * must look the key up again.
 */
class RateWindow {

    private final int maxRequests;
    private final long windowMillis;
    private final Deque<Long> timestamps = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private boolean retired;

    RateWindow(int maxRequests, long windowMillis) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0");
        }
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("window must be > 0");
        }
        this.maxRequests = maxRequests;
        this.windowMillis = windowMillis;
    }

    /**
     * @return the decision, or null if this window was retired and the key must be resolved again
     */
    RateLimitDecision tryAcquire(long nowMillis, LimitDimension dimension) {
        lock.lock();
        try {
            if (retired) {
                return null;
            }
            purge(nowMillis);

            if (timestamps.size() < maxRequests) {
                timestamps.addLast(nowMillis);
                return RateLimitDecision.admit(dimension, maxRequests, maxRequests - timestamps.size());
            }

            long waitMillis = timestamps.peekFirst() + windowMillis - nowMillis;
            long retryAfter = Math.max(1, (waitMillis + 999) / 1000);
            return RateLimitDecision.deny(dimension, maxRequests, retryAfter);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retire the window if nothing in it is still inside the time window
     *
     * @return true if the window was retired and may be dropped
     */
    boolean retireIfIdle(long nowMillis) {
        lock.lock();
        try {
            purge(nowMillis);
            if (timestamps.isEmpty()) {
                retired = true;
            }
            return retired;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return timestamps.size();
        } finally {
            lock.unlock();
        }
    }

    private void purge(long nowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }
}
