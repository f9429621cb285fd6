package com.comicguess.dailypuzzle.ratelimit;

/**
 * Rate-limit class of an endpoint. Guess submission has its own, tighter limits.
 */
public enum EndpointClass {
    GUESS,
    GENERAL;

    public static EndpointClass forPath(String path) {
        return path != null && path.contains("/guess") ? GUESS : GENERAL;
    }
}
