package com.techStack.courseHub.repository.store;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.techStack.courseHub.exception.CourseHubException;
import com.techStack.courseHub.exception.service.ServiceUnavailableException;
import com.techStack.courseHub.util.firebase.FirestoreUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Firestore-backed {@link DocumentStore}.
 *
 * Responsibilities:
 * - ApiFuture to Mono bridging
 * - Translation of client failures into ServiceUnavailableException
 *
 * Deadlines belong to the calling operation, see {@link OperationDeadline}.
 */
@Repository
public class FirestoreDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(FirestoreDocumentStore.class);

    private final Firestore firestore;

    public FirestoreDocumentStore(Firestore firestore) {
        this.firestore = firestore;
    }

    // ============================================================================
    // READS
    // ============================================================================

    @Override
    public Mono<StoredDocument> get(CollectionPath collection, String documentId) {
        Mono<StoredDocument> read = Mono.fromFuture(() -> FirestoreUtil.toCompletableFuture(
                        collectionRef(collection).document(documentId).get()))
                .filter(DocumentSnapshot::exists)
                .map(FirestoreDocumentStore::toStoredDocument);
        return guard(read, "get " + collection + "/" + documentId);
    }

    @Override
    public Flux<StoredDocument> list(CollectionPath collection) {
        return runQuery(collectionRef(collection), "list " + collection);
    }

    @Override
    public Flux<StoredDocument> query(CollectionPath collection, Map<String, Object> equalities) {
        Query query = collectionRef(collection);
        for (Map.Entry<String, Object> filter : equalities.entrySet()) {
            query = query.whereEqualTo(filter.getKey(), filter.getValue());
        }
        return runQuery(query, "query " + collection + " where " + equalities.keySet());
    }

    private Flux<StoredDocument> runQuery(Query query, String description) {
        Flux<StoredDocument> documents = Mono.fromFuture(() -> FirestoreUtil.toCompletableFuture(query.get()))
                .flatMapIterable(snapshot -> snapshot.getDocuments())
                .map(FirestoreDocumentStore::toStoredDocument);
        return guard(documents.collectList(), description).flatMapIterable(list -> list);
    }

    // ============================================================================
    // WRITES
    // ============================================================================

    @Override
    public Mono<Void> set(CollectionPath collection, String documentId, Map<String, Object> data) {
        Mono<Void> write = Mono.fromFuture(() -> FirestoreUtil.toCompletableFuture(
                        collectionRef(collection).document(documentId).set(data)))
                .then();
        return guard(write, "set " + collection + "/" + documentId);
    }

    @Override
    public Mono<Void> update(CollectionPath collection, String documentId, Map<String, Object> fields) {
        Mono<Void> write = Mono.fromFuture(() -> FirestoreUtil.toCompletableFuture(
                        collectionRef(collection).document(documentId).update(fields)))
                .then();
        return guard(write, "update " + collection + "/" + documentId);
    }

    @Override
    public Mono<Void> delete(CollectionPath collection, String documentId) {
        Mono<Void> write = Mono.fromFuture(() -> FirestoreUtil.toCompletableFuture(
                        collectionRef(collection).document(documentId).delete()))
                .then();
        return guard(write, "delete " + collection + "/" + documentId);
    }

    @Override
    public Mono<String> add(CollectionPath collection, Map<String, Object> data) {
        Mono<String> write = Mono.fromFuture(() -> FirestoreUtil.toCompletableFuture(
                        collectionRef(collection).add(data)))
                .map(reference -> reference.getId());
        return guard(write, "add to " + collection);
    }

    // ============================================================================
    // HELPERS
    // ============================================================================

    private CollectionReference collectionRef(CollectionPath collection) {
        return firestore.collection(collection.path());
    }

    private <T> Mono<T> guard(Mono<T> operation, String description) {
        return operation
                .onErrorMap(e -> !(e instanceof CourseHubException), e -> translate(e, description));
    }

    private ServiceUnavailableException translate(Throwable error, String description) {
        logger.error("Data store request failed: {}", description, error);
        return new ServiceUnavailableException("Data store request failed", error);
    }

    private static StoredDocument toStoredDocument(DocumentSnapshot snapshot) {
        Map<String, Object> data = new LinkedHashMap<>();
        Map<String, Object> raw = snapshot.getData();
        if (raw != null) {
            raw.forEach((key, value) -> data.put(key, value instanceof Timestamp timestamp
                    ? timestamp.toDate().toInstant().toString()
                    : value));
        }
        return new StoredDocument(snapshot.getId(), data);
    }
}
