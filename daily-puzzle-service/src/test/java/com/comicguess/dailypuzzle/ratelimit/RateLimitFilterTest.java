package com.comicguess.dailypuzzle.ratelimit;

import com.comicguess.dailypuzzle.security.JwtUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RateLimitProperties properties;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        properties = new RateLimitProperties();
        properties.getGuess().setIp(new RateLimitProperties.WindowLimit(2, 60));
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(properties,
                Clock.fixed(Instant.parse("2024-01-15T12:00:00Z"), ZoneOffset.UTC));
        ClientIdentityResolver resolver = new ClientIdentityResolver(
                new JwtUtil("test-secret-that-is-long-enough-for-hs256"));
        filter = new RateLimitFilter(limiter, resolver, properties, objectMapper);
    }

    @Test
    void admittedRequestPassesWithHeaders() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(guessRequest(), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("2");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("1");
    }

    @Test
    void deniedRequestGets429WithBody() throws Exception {
        filter.doFilter(guessRequest(), new MockHttpServletResponse(), new MockFilterChain());
        filter.doFilter(guessRequest(), new MockHttpServletResponse(), new MockFilterChain());

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(guessRequest(), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("60");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("0");

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("error").asText()).isEqualTo("rate_limited");
        assertThat(body.get("retry_after").asLong()).isEqualTo(60);
        assertThat(body.get("limit_type").asText()).isEqualTo("ip");
    }

    @Test
    void nonApiAndPreflightRequestsAreNotLimited() throws Exception {
        properties.getGeneral().setIp(new RateLimitProperties.WindowLimit(1, 60));

        for (int i = 0; i < 3; i++) {
            MockHttpServletRequest health = new MockHttpServletRequest("GET", "/actuator/health");
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(health, new MockHttpServletResponse(), chain);
            assertThat(chain.getRequest()).isNotNull();

            MockHttpServletRequest preflight = new MockHttpServletRequest("OPTIONS", "/api/game/guess");
            MockFilterChain preflightChain = new MockFilterChain();
            filter.doFilter(preflight, new MockHttpServletResponse(), preflightChain);
            assertThat(preflightChain.getRequest()).isNotNull();
        }
    }

    @Test
    void disabledLimiterPassesEverything() throws Exception {
        properties.setEnabled(false);

        for (int i = 0; i < 5; i++) {
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(guessRequest(), new MockHttpServletResponse(), chain);
            assertThat(chain.getRequest()).isNotNull();
        }
    }

    private static MockHttpServletRequest guessRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/game/guess");
        request.setRemoteAddr("203.0.113.7");
        return request;
    }
}
