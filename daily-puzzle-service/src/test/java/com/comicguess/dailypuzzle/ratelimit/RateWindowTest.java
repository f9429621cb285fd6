package com.comicguess.dailypuzzle.ratelimit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RateWindowTest {

    @Test
    void testAdmitsUpToLimitThenDenies() {
        RateWindow window = new RateWindow(3, 5_000);

        assertTrue(window.tryAcquire(0, LimitDimension.IP).admitted());
        assertTrue(window.tryAcquire(1_000, LimitDimension.IP).admitted());
        RateLimitDecision third = window.tryAcquire(2_000, LimitDimension.IP);
        assertTrue(third.admitted());
        assertEquals(0, third.remaining());

        RateLimitDecision fourth = window.tryAcquire(2_500, LimitDimension.IP);
        assertFalse(fourth.admitted());
        // Oldest entry (t=0) leaves the window at t=5000
        assertEquals(3, fourth.retryAfterSeconds());
        assertEquals(3, window.size(), "Denied requests are not recorded");
    }

    @Test
    void testEntryAtWindowEdgeIsExpired() {
        RateWindow window = new RateWindow(1, 5_000);

        assertTrue(window.tryAcquire(0, LimitDimension.USER).admitted());
        assertFalse(window.tryAcquire(4_999, LimitDimension.USER).admitted());
        assertTrue(window.tryAcquire(5_000, LimitDimension.USER).admitted());
    }

    @Test
    void testRetryAfterIsAtLeastOneSecond() {
        RateWindow window = new RateWindow(1, 5_000);
        window.tryAcquire(0, LimitDimension.IP);

        assertEquals(1, window.tryAcquire(4_900, LimitDimension.IP).retryAfterSeconds());
    }

    @Test
    void testOnlyIdleWindowIsRetired() {
        RateWindow window = new RateWindow(2, 5_000);
        window.tryAcquire(0, LimitDimension.IP);

        assertFalse(window.retireIfIdle(4_000), "Window with a live entry must not be retired");
        assertTrue(window.tryAcquire(4_000, LimitDimension.IP).admitted());

        assertTrue(window.retireIfIdle(9_000));
        assertNull(window.tryAcquire(9_000, LimitDimension.IP), "Retired window admits nothing");
    }

    @Test
    void testInvalidLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RateWindow(0, 1_000));
        assertThrows(IllegalArgumentException.class, () -> new RateWindow(1, 0));
    }
}
