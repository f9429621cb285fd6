package com.comicguess.dailypuzzle.ratelimit;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Sliding-window-log limiter over two dimensions (network address and user) and two
 * endpoint classes. State is process-local.
 */
@Component
public class SlidingWindowRateLimiter {

    private static final String OVERFLOW_KEY = "*overflow*";

    private final RateLimitProperties properties;
    private final Clock clock;
    private final WindowRegistry registry;

    public SlidingWindowRateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.registry = new WindowRegistry(properties.getMaxTrackedKeys());
    }

    /**
     * Check one key in one dimension, recording the request if admitted
     */
    public RateLimitDecision admit(String clientKey, EndpointClass endpointClass,
                                   LimitDimension dimension, Instant now) {
        RateLimitProperties.WindowLimit limit = properties.limitFor(endpointClass, dimension);
        String prefix = dimension.getLabel() + ":" + endpointClass.name() + ":";
        long nowMillis = now.toEpochMilli();
        while (true) {
            RateWindow window = registry.getOrCreate(prefix + clientKey, prefix + OVERFLOW_KEY,
                    () -> new RateWindow(limit.getMaxRequests(), limit.getWindowSeconds() * 1000L), nowMillis);
            RateLimitDecision decision = window.tryAcquire(nowMillis, dimension);
            if (decision != null) {
                return decision;
            }
            // Window was dropped as idle between lookup and use
        }
    }

    /**
     * Network dimension first, then the user dimension when the caller is identified.
     * A request admitted by the network dimension keeps that slot even if the user dimension denies.
     */
    public RateLimitDecision check(ClientIdentity identity, EndpointClass endpointClass, Instant now) {
        RateLimitDecision network = admit(identity.networkKey(), endpointClass, LimitDimension.IP, now);
        if (!network.admitted() || !identity.hasUser()) {
            return network;
        }
        RateLimitDecision user = admit(identity.userKey(), endpointClass, LimitDimension.USER, now);
        if (!user.admitted()) {
            return user;
        }
        return user.remaining() <= network.remaining() ? user : network;
    }

    public RateLimitDecision checkRateLimit(ClientIdentity identity, EndpointClass endpointClass) {
        return check(identity, endpointClass, clock.instant());
    }

    int trackedKeys() {
        return registry.size();
    }
}
