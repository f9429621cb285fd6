package com.comicguess.dailypuzzle.ratelimit;

/**
 * Who a request counts against. {@code userKey} is null for anonymous or unverifiable callers.
 */
public record ClientIdentity(String networkKey, String userKey) {

    public static final String UNKNOWN = "unknown";

    public boolean hasUser() {
        return userKey != null;
    }
}
