package com.comicguess.dailypuzzle.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Bounded key to window map. Only idle windows (no timestamps left inside their time window)
 * are ever dropped, so a key over its limit stays limited. When the bound is reached and every
 * tracked window is still live, new keys share an overflow window per overflow key.
 */
@Slf4j
class WindowRegistry {

    private static final long SWEEP_BACKOFF_MILLIS = 1_000;

    private final int maxKeys;
    private final Map<String, RateWindow> windows = new HashMap<>();
    private final Map<String, RateWindow> overflow = new HashMap<>();
    private long nextSweepMillis = Long.MIN_VALUE;
    private boolean overflowing;

    WindowRegistry(int maxKeys) {
        if (maxKeys <= 0) {
            throw new IllegalArgumentException("maxKeys must be > 0");
        }
        this.maxKeys = maxKeys;
    }

    synchronized RateWindow getOrCreate(String key, String overflowKey, Supplier<RateWindow> factory, long nowMillis) {
        RateWindow window = windows.get(key);
        if (window != null) {
            return window;
        }

        if (windows.size() >= maxKeys) {
            sweep(nowMillis);
        }
        if (windows.size() < maxKeys) {
            if (overflowing) {
                overflowing = false;
                log.info("Rate-limit registry below its bound of {} keys again", maxKeys);
            }
            window = factory.get();
            windows.put(key, window);
            return window;
        }

        if (!overflowing) {
            overflowing = true;
            log.warn("Rate-limit registry holds {} live keys; new keys share overflow windows", maxKeys);
        }
        RateWindow shared = overflow.get(overflowKey);
        if (shared == null || shared.retireIfIdle(nowMillis)) {
            shared = factory.get();
            overflow.put(overflowKey, shared);
        }
        return shared;
    }

    synchronized int size() {
        return windows.size();
    }

    private void sweep(long nowMillis) {
        if (nowMillis < nextSweepMillis) {
            return;
        }
        int before = windows.size();
        Iterator<RateWindow> it = windows.values().iterator();
        while (it.hasNext()) {
            if (it.next().retireIfIdle(nowMillis)) {
                it.remove();
            }
        }
        int removed = before - windows.size();
        // A sweep that frees nothing is not repeated for every new key
        nextSweepMillis = removed == 0 ? nowMillis + SWEEP_BACKOFF_MILLIS : Long.MIN_VALUE;
        log.debug("Swept {} idle rate-limit windows, {} remain", removed, windows.size());
    }
}
