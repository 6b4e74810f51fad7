package com.techStack.courseHub.models.faculty;

/**
 * Sub-collections that live under {@code faculties/{facultyId}}.
 */
public enum FacultyCollection {
    COURSES("courses", "course"),
    PROGRAMS("programs", "program"),
    BRANCHES("branches", "branch");

    private final String collectionName;
    private final String itemName;

    FacultyCollection(String collectionName, String itemName) {
        this.collectionName = collectionName;
        this.itemName = itemName;
    }

    public String collectionName() {
        return collectionName;
    }

    /** Singular noun used in log and error messages. */
    public String itemName() {
        return itemName;
    }
}
