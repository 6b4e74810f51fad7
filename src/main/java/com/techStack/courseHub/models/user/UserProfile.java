package com.techStack.courseHub.models.user;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.techStack.courseHub.constants.CollectionConstants;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User profile stored at {@code users/{uid}}.
 *
 * {@code uid} never changes after creation; {@code role} and the allow-listed
 * attributes change only through a profile update.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"uid", "role"})
public class UserProfile {

    private final String uid;
    private final String role;
    private final Map<String, Object> attributes;

    public UserProfile(String uid, String role, Map<String, Object> attributes) {
        this.uid = uid;
        this.role = role;
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.remove(CollectionConstants.FIELD_UID);
        copy.remove(CollectionConstants.FIELD_ROLE);
        this.attributes = Collections.unmodifiableMap(copy);
    }

    /**
     * Profile created on first registration
     */
    public static UserProfile newStudent(String uid) {
        return new UserProfile(uid, CollectionConstants.DEFAULT_ROLE, Map.of());
    }

    public static UserProfile fromDocument(String documentId, Map<String, Object> data) {
        Object storedUid = data.get(CollectionConstants.FIELD_UID);
        Object storedRole = data.get(CollectionConstants.FIELD_ROLE);
        return new UserProfile(
                storedUid != null ? storedUid.toString() : documentId,
                storedRole != null ? storedRole.toString() : CollectionConstants.DEFAULT_ROLE,
                data);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>(attributes);
        document.put(CollectionConstants.FIELD_UID, uid);
        document.put(CollectionConstants.FIELD_ROLE, role);
        return document;
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
