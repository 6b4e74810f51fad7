package com.techStack.courseHub.handler;

import com.techStack.courseHub.dto.response.ErrorResponse;
import com.techStack.courseHub.exception.CourseHubException;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.Clock;

/**
 * Global Exception Handler
 *
 * The only place where an {@link com.techStack.courseHub.exception.ErrorKind} becomes an
 * HTTP status. Store detail is logged here and never copied into the response.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(CourseHubException.class)
    public ResponseEntity<ErrorResponse> handleDomainException(CourseHubException ex, ServerWebExchange exchange) {
        HttpStatus status = switch (ex.getKind()) {
            case UNAUTHORIZED, TOKEN_EXPIRED -> HttpStatus.UNAUTHORIZED;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case UNAVAILABLE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        String message = switch (ex.getKind()) {
            case UNAUTHORIZED -> "Unauthorized";
            case TOKEN_EXPIRED -> "Token has expired";
            case UNAVAILABLE -> "Failed to retrieve data: " + ex.getMessage();
            default -> ex.getMessage();
        };

        String field = ex instanceof InvalidInputException invalid ? invalid.getField() : null;

        if (status.is5xxServerError()) {
            log.error("{} {} failed: {}", exchange.getRequest().getMethod(), path(exchange), ex.getMessage(), ex);
        } else {
            log.debug("{} {} rejected with {}: {}", exchange.getRequest().getMethod(), path(exchange),
                    ex.getKind(), ex.getMessage());
        }

        return build(status, ex.getKind().name(), message, field, exchange);
    }

    /**
     * Framework statuses such as 405 for a wrong method keep their code
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        String reason = status != null ? status.getReasonPhrase() : String.valueOf(statusCode.value());
        String message = ex.getReason() != null ? ex.getReason() : reason;

        return ResponseEntity.status(statusCode)
                .headers(ex.getHeaders())
                .body(ErrorResponse.builder()
                        .status(statusCode.value())
                        .error(reason)
                        .message(message)
                        .path(path(exchange))
                        .timestamp(clock.instant())
                        .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {} {}", exchange.getRequest().getMethod(), path(exchange), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Failed to process request", null, exchange);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status,
                                                String error,
                                                String message,
                                                String field,
                                                ServerWebExchange exchange) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .field(field)
                .path(path(exchange))
                .timestamp(clock.instant())
                .build());
    }

    private static String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }
}
