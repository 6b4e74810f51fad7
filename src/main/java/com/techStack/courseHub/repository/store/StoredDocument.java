package com.techStack.courseHub.repository.store;

import java.util.Map;

/**
 * A document as read from the store: its id within the collection plus its fields.
 */
public record StoredDocument(String id, Map<String, Object> data) {

    public StoredDocument {
        data = data == null ? Map.of() : data;
    }
}
