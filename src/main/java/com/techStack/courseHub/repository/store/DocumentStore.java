package com.techStack.courseHub.repository.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Hierarchical document store addressed by collection path and document id.
 *
 * Single-document operations are atomic; nothing spanning several calls is. Implementations
 * surface store failures as {@link com.techStack.courseHub.exception.service.ServiceUnavailableException};
 * callers bound whole operations with {@link OperationDeadline}.
 */
public interface DocumentStore {

    /**
     * @return the document, or an empty Mono when it does not exist
     */
    Mono<StoredDocument> get(CollectionPath collection, String documentId);

    Flux<StoredDocument> list(CollectionPath collection);

    /**
     * Documents whose fields equal every given value. Numbers compare numerically,
     * so a filter on {@code 3L} matches a stored {@code 3} or {@code 3.0}.
     */
    Flux<StoredDocument> query(CollectionPath collection, Map<String, Object> equalities);

    /** Creates or overwrites the document. */
    Mono<Void> set(CollectionPath collection, String documentId, Map<String, Object> data);

    /** Merges the given fields into an existing document. */
    Mono<Void> update(CollectionPath collection, String documentId, Map<String, Object> fields);

    Mono<Void> delete(CollectionPath collection, String documentId);

    /**
     * Stores a new document under a generated id.
     *
     * @return the generated id
     */
    Mono<String> add(CollectionPath collection, Map<String, Object> data);
}
