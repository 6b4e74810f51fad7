package com.techStack.courseHub.util.auth;

import com.techStack.courseHub.models.auth.SessionToken;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.server.reactive.ServerHttpRequest;

import java.util.Optional;

/**
 * Moves session tokens between the service and the browser: an HTTP-only, Secure,
 * SameSite=Strict cookie on the way out; that cookie or a Bearer header on the way in.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class TokenTransport {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String COOKIE_PATH = "/";
    private static final String SAME_SITE_STRICT = "Strict";

    public static ResponseCookie tokenCookie(String cookieName, SessionToken token) {
        return ResponseCookie.from(cookieName, token.value())
                .httpOnly(true)
                .secure(true)
                .sameSite(SAME_SITE_STRICT)
                .path(COOKIE_PATH)
                .maxAge(token.lifetime())
                .build();
    }

    /**
     * Cookie first, then {@code Authorization: Bearer}
     */
    public static Optional<String> extractToken(ServerHttpRequest request, String cookieName) {
        HttpCookie cookie = request.getCookies().getFirst(cookieName);
        if (cookie != null && !cookie.getValue().isBlank()) {
            return Optional.of(cookie.getValue());
        }

        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        }
        return Optional.empty();
    }
}
