package com.techStack.courseHub.repository.store;

import com.techStack.courseHub.config.integration.FirestoreProperties;
import com.techStack.courseHub.exception.service.ServiceUnavailableException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * One deadline for a whole repository or service operation, however many store round
 * trips it makes. Expiry surfaces as {@link ServiceUnavailableException}.
 */
@Slf4j
@Component
public class OperationDeadline {

    @Getter
    private final Duration timeout;

    @Autowired
    public OperationDeadline(FirestoreProperties properties) {
        this(properties.getRequestTimeout());
    }

    public OperationDeadline(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> Mono<T> bound(Mono<T> operation, String description) {
        return operation
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> expired(description, e));
    }

    /**
     * Bounds the complete stream, not the gap between items
     */
    public <T> Flux<T> bound(Flux<T> operation, String description) {
        return bound(operation.collectList(), description).flatMapIterable(items -> items);
    }

    private ServiceUnavailableException expired(String description, TimeoutException cause) {
        log.error("Deadline of {} exceeded: {}", timeout, description);
        return new ServiceUnavailableException("Data store request timed out", cause);
    }
}
