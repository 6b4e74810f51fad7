package com.techStack.courseHub.security.authentication;

import com.techStack.courseHub.exception.auth.TokenExpiredException;
import com.techStack.courseHub.exception.auth.UnauthorizedException;
import com.techStack.courseHub.service.token.TokenService;
import com.techStack.courseHub.util.auth.TokenTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Session Token Filter
 *
 * Verifies the token cookie (or Bearer header) and exposes its subject as the principal.
 * Requests without a token pass through unauthenticated; a presented token that fails
 * verification ends the exchange with a 401.
 */
@Slf4j
public class TokenAuthenticationFilter implements WebFilter {

    static final Set<String> PUBLIC_PATH_PREFIXES = Set.of(
            "/api/auth/",
            "/actuator/health",
            "/swagger-ui",
            "/v3/api-docs",
            "/webjars/"
    );

    private static final List<SimpleGrantedAuthority> AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final TokenService tokenService;
    private final ServerAuthenticationEntryPoint entryPoint;
    private final String cookieName;

    public TokenAuthenticationFilter(TokenService tokenService,
                                     ServerAuthenticationEntryPoint entryPoint,
                                     String cookieName) {
        this.tokenService = tokenService;
        this.entryPoint = entryPoint;
        this.cookieName = cookieName;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        // A stale cookie must not block a fresh login
        if (isPublicPath(exchange.getRequest().getPath().value())) {
            return chain.filter(exchange);
        }

        Optional<String> token = TokenTransport.extractToken(exchange.getRequest(), cookieName);
        if (token.isEmpty()) {
            return chain.filter(exchange);
        }

        String subjectId;
        try {
            subjectId = tokenService.verify(token.get());
        } catch (TokenExpiredException | UnauthorizedException e) {
            log.debug("Token rejected for {}: {}", exchange.getRequest().getPath(), e.getKind());
            return entryPoint.commence(exchange, new BadCredentialsException(e.getMessage(), e));
        }

        Authentication authentication = new UsernamePasswordAuthenticationToken(subjectId, null, AUTHORITIES);
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
    }

    static boolean isPublicPath(String path) {
        return PUBLIC_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }
}
