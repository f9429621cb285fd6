package com.comicguess.dailypuzzle.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyedLocksTest {

    @Test
    void testSameKeySameLock() {
        KeyedLocks locks = new KeyedLocks();
        assertSame(locks.lockFor("user-1:42"), locks.lockFor("user-1:42"));
    }

    @Test
    void testStripeCountMustBePowerOfTwo() {
        assertThrows(IllegalArgumentException.class, () -> new KeyedLocks(100));
        assertNotNull(new KeyedLocks(1).lockFor("anything"));
    }
}
