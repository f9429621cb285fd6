package com.comicguess.dailypuzzle.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits bound from {@code rate-limit.*}
 */
@Data
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;

    /**
     * Upper bound on tracked windows; least recently used keys are dropped beyond it
     */
    private int maxTrackedKeys = 10_000;

    private EndpointLimits guess = new EndpointLimits(new WindowLimit(30, 60), new WindowLimit(10, 60));

    private EndpointLimits general = new EndpointLimits(new WindowLimit(100, 60), new WindowLimit(60, 60));

    public WindowLimit limitFor(EndpointClass endpointClass, LimitDimension dimension) {
        EndpointLimits limits = endpointClass == EndpointClass.GUESS ? guess : general;
        return dimension == LimitDimension.IP ? limits.getIp() : limits.getUser();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EndpointLimits {
        private WindowLimit ip = new WindowLimit();
        private WindowLimit user = new WindowLimit();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WindowLimit {
        private int maxRequests = 60;
        private int windowSeconds = 60;
    }
}
