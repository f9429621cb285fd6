package com.comicguess.dailypuzzle.ratelimit;

/**
 * Outcome of a rate-limit check. {@code dimension} names the dimension that decided:
 * the denying one, or the tightest one checked when admitted.
 */
public record RateLimitDecision(boolean admitted,
                                long retryAfterSeconds,
                                LimitDimension dimension,
                                int limit,
                                int remaining) {

    public static RateLimitDecision admit(LimitDimension dimension, int limit, int remaining) {
        return new RateLimitDecision(true, 0, dimension, limit, remaining);
    }

    public static RateLimitDecision deny(LimitDimension dimension, int limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, retryAfterSeconds, dimension, limit, 0);
    }
}
