package com.techStack.courseHub.repository.faculty;

import com.techStack.courseHub.constants.CollectionConstants;
import com.techStack.courseHub.exception.resource.ResourceNotFoundException;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import com.techStack.courseHub.models.faculty.Faculty;
import com.techStack.courseHub.models.faculty.FacultyCollection;
import com.techStack.courseHub.models.faculty.FacultyScopedItem;
import com.techStack.courseHub.repository.store.CollectionPath;
import com.techStack.courseHub.repository.store.DocumentStore;
import com.techStack.courseHub.repository.store.OperationDeadline;
import com.techStack.courseHub.repository.store.StoredDocument;
import com.techStack.courseHub.util.validation.ValidationUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read access to {@code faculties/{facultyId}/{collection}/{itemId}}.
 *
 * Every call is a live query against the document store, bounded by one {@link OperationDeadline};
 * nothing is cached. Equality filters need no index up front, but large collections should have
 * one in the store.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FacultyCollectionRepository {

    private final DocumentStore documentStore;
    private final OperationDeadline operationDeadline;

    /**
     * Lists the top-level faculties
     */
    public Flux<Faculty> getFaculties() {
        return operationDeadline.bound(
                documentStore.list(CollectionPath.root(CollectionConstants.COLLECTION_FACULTIES))
                        .map(document -> new Faculty(document.id(), document.data())),
                "list faculties");
    }

    /**
     * Every item of the sub-collection; empty when there are none
     */
    public Flux<FacultyScopedItem> getAll(String facultyId, FacultyCollection collection) {
        Flux<FacultyScopedItem> items = Flux.defer(() -> documentStore.list(pathOf(facultyId, collection))
                .map(document -> toItem(facultyId, collection, document))
                .doOnComplete(() -> log.debug("Listed {} of faculty {}", collection.collectionName(), facultyId)));
        return operationDeadline.bound(items, "list " + collection.collectionName() + " of faculty " + facultyId);
    }

    /**
     * Point lookup; fails with ResourceNotFoundException when absent
     */
    public Mono<FacultyScopedItem> getById(String facultyId, FacultyCollection collection, String itemId) {
        return operationDeadline.bound(Mono.defer(() -> {
            CollectionPath path = pathOf(facultyId, collection);
            String documentId = ValidationUtils.requirePathSegment(itemId, collection.itemName() + "Id");

            return documentStore.get(path, documentId)
                    .map(document -> toItem(facultyId, collection, document))
                    .switchIfEmpty(Mono.error(new ResourceNotFoundException(String.format(
                            "No %s with id %s in faculty %s", collection.itemName(), itemId, facultyId))));
        }), "get " + collection.itemName() + " " + itemId + " of faculty " + facultyId);
    }

    /**
     * Items whose numeric field equals the given value
     */
    public Flux<FacultyScopedItem> getByFilter(String facultyId,
                                               FacultyCollection collection,
                                               String fieldName,
                                               long fieldValue) {
        return getByFilters(facultyId, collection, Map.of(fieldName, fieldValue));
    }

    /**
     * Items matching every numeric equality filter
     */
    public Flux<FacultyScopedItem> getByFilters(String facultyId,
                                                FacultyCollection collection,
                                                Map<String, Long> filters) {
        return operationDeadline.bound(Flux.defer(() -> {
            if (filters.isEmpty()) {
                throw new InvalidInputException("filter", "At least one filter is required");
            }
            Map<String, Object> equalities = new LinkedHashMap<>();
            filters.forEach((field, value) -> {
                if (StringUtils.isBlank(field)) {
                    throw new InvalidInputException("filter", "Filter field name must not be blank");
                }
                equalities.put(field, value);
            });

            return documentStore.query(pathOf(facultyId, collection), equalities)
                    .map(document -> toItem(facultyId, collection, document));
        }), "filter " + collection.collectionName() + " of faculty " + facultyId + " by " + filters);
    }

    private static CollectionPath pathOf(String facultyId, FacultyCollection collection) {
        return CollectionPath.root(CollectionConstants.COLLECTION_FACULTIES)
                .subCollection(facultyId, collection.collectionName());
    }

    private static FacultyScopedItem toItem(String facultyId, FacultyCollection collection, StoredDocument document) {
        return new FacultyScopedItem(document.id(), facultyId, collection, document.data());
    }
}
