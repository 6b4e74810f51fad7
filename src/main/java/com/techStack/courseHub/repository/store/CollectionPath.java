package com.techStack.courseHub.repository.store;

import com.techStack.courseHub.util.validation.ValidationUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Slash-free segments addressing a collection: {@code collection(/document/collection)*}.
 * Every segment is validated, so caller-supplied ids cannot point outside their collection.
 */
public record CollectionPath(List<String> segments) {

    public CollectionPath {
        if (segments.isEmpty() || segments.size() % 2 == 0) {
            throw new IllegalArgumentException("A collection path needs an odd number of segments: " + segments);
        }
        segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public static CollectionPath root(String collection) {
        return new CollectionPath(List.of(ValidationUtils.requirePathSegment(collection, "collection")));
    }

    public CollectionPath subCollection(String documentId, String collection) {
        List<String> child = new ArrayList<>(segments);
        child.add(ValidationUtils.requirePathSegment(documentId, "documentId"));
        child.add(ValidationUtils.requirePathSegment(collection, "collection"));
        return new CollectionPath(child);
    }

    public String path() {
        return String.join("/", segments);
    }

    @Override
    public String toString() {
        return path();
    }
}
