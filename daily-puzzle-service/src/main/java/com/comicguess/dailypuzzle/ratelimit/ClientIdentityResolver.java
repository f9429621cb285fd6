package com.comicguess.dailypuzzle.ratelimit;

import com.comicguess.dailypuzzle.security.JwtUtil;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives the rate-limit identity of a request. Never fails: problems fall back to the
 * network-only identity.
 */
@Slf4j
@Component
public class ClientIdentityResolver {

    private final JwtUtil jwtUtil;

    public ClientIdentityResolver(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    public ClientIdentity resolve(HttpServletRequest request) {
        return new ClientIdentity(networkKey(request), userKey(request));
    }

    static String networkKey(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String firstHop = forwarded.split(",")[0].trim();
            if (!firstHop.isEmpty()) {
                return firstHop;
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        if (remote != null && !remote.isBlank()) {
            return remote;
        }
        return ClientIdentity.UNKNOWN;
    }

    private String userKey(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            return null;
        }
        try {
            return jwtUtil.extractUserId(authHeader.substring(7));
        } catch (RuntimeException e) {
            // Unverifiable tokens are limited by network address only; the controller rejects them
            log.debug("Rate limiting {} by network address only: {}", request.getRequestURI(), e.getMessage());
            return null;
        }
    }
}
