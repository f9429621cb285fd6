package com.comicguess.dailypuzzle.util;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of lock stripes. Equal keys always map to the same lock; distinct keys may share one.
 */
@Component
public class KeyedLocks {

    private static final int DEFAULT_STRIPES = 128;

    private final ReentrantLock[] stripes;

    public KeyedLocks() {
        this(DEFAULT_STRIPES);
    }

    KeyedLocks(int stripeCount) {
        if (Integer.bitCount(stripeCount) != 1) {
            throw new IllegalArgumentException("Stripe count must be a power of two: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return stripes[h & (stripes.length - 1)];
    }
}
