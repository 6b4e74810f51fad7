package com.techStack.courseHub.constants;

public final class CollectionConstants {

    private CollectionConstants() {
    }

    // Top-level collections
    public static final String COLLECTION_FACULTIES = "faculties";
    public static final String COLLECTION_USERS = "users";

    // Per-user sub-collections
    public static final String COLLECTION_USER_EVENTS = "events";

    // Profile fields
    public static final String FIELD_UID = "uid";
    public static final String FIELD_ROLE = "role";
    public static final String DEFAULT_ROLE = "Student";
}
