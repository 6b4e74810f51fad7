package com.techStack.courseHub.security.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.courseHub.dto.response.ErrorResponse;
import com.techStack.courseHub.exception.CourseHubException;
import com.techStack.courseHub.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Custom Authentication Entry Point
 *
 * Writes every authentication failure as a 401. An expired token gets its own message so
 * clients can send the user back to login instead of showing a generic error.
 */
@Component
@RequiredArgsConstructor
public class CustomAuthenticationEntryPoint implements ServerAuthenticationEntryPoint {

    private static final Logger logger = LoggerFactory.getLogger(CustomAuthenticationEntryPoint.class);

    public static final String EXPIRED_MESSAGE = "Token has expired";
    public static final String UNAUTHORIZED_MESSAGE = "Unauthorized";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Mono<Void> commence(ServerWebExchange exchange, AuthenticationException ex) {
        String path = exchange.getRequest().getPath().value();
        ErrorKind kind = resolveKind(ex);
        String message = kind == ErrorKind.TOKEN_EXPIRED ? EXPIRED_MESSAGE : UNAUTHORIZED_MESSAGE;

        logger.warn("Security event: unauthorized_access kind={} method={} path={}",
                kind, exchange.getRequest().getMethod(), path);

        ErrorResponse body = ErrorResponse.builder()
                .status(HttpStatus.UNAUTHORIZED.value())
                .error(kind.name())
                .message(message)
                .path(path)
                .timestamp(clock.instant())
                .build();

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getHeaders().set(HttpHeaders.CACHE_CONTROL, "no-store");

        return response.writeWith(Mono.fromCallable(() -> toBuffer(response, body)));
    }

    private static ErrorKind resolveKind(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof CourseHubException domain) {
                return domain.getKind();
            }
        }
        return ErrorKind.UNAUTHORIZED;
    }

    private DataBuffer toBuffer(ServerHttpResponse response, ErrorResponse body) throws JsonProcessingException {
        byte[] bytes = objectMapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        return response.bufferFactory().wrap(bytes);
    }
}
