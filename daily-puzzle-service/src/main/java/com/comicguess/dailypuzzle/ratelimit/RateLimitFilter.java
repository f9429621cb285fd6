package com.comicguess.dailypuzzle.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the sliding-window limits to every {@code /api/} request before it reaches a controller
 */
@Slf4j
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private final SlidingWindowRateLimiter rateLimiter;
    private final ClientIdentityResolver identityResolver;
    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(SlidingWindowRateLimiter rateLimiter,
                           ClientIdentityResolver identityResolver,
                           RateLimitProperties properties,
                           ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.identityResolver = identityResolver;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String uri = request.getRequestURI();
        return uri == null || !uri.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        EndpointClass endpointClass = EndpointClass.forPath(request.getRequestURI());
        ClientIdentity identity = identityResolver.resolve(request);
        RateLimitDecision decision = rateLimiter.checkRateLimit(identity, endpointClass);

        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.limit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));

        if (decision.admitted()) {
            chain.doFilter(request, response);
            return;
        }

        log.warn("Rate limit exceeded for {} {} on {} ({} limit {}), retry after {}s",
                decision.dimension().getLabel(),
                decision.dimension() == LimitDimension.USER ? identity.userKey() : identity.networkKey(),
                request.getRequestURI(), endpointClass, decision.limit(), decision.retryAfterSeconds());
        writeDenial(response, decision);
    }

    private void writeDenial(HttpServletResponse response, RateLimitDecision decision) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "rate_limited");
        body.put("detail", "Too many requests, retry in " + decision.retryAfterSeconds() + " seconds");
        body.put("retry_after", decision.retryAfterSeconds());
        body.put("limit_type", decision.dimension().getLabel());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(decision.retryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }
}
