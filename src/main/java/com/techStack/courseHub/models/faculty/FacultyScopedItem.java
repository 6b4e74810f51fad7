package com.techStack.courseHub.models.faculty;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A course, program or branch stored at {@code faculties/{facultyId}/{collection}/{id}}.
 * Serialized flat: {@code {"id": ..., <attributes>}}.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"id"})
public class FacultyScopedItem {

    private final String id;

    @JsonIgnore
    private final String facultyId;

    @JsonIgnore
    private final FacultyCollection collection;

    private final Map<String, Object> attributes;

    public FacultyScopedItem(String id, String facultyId, FacultyCollection collection, Map<String, Object> attributes) {
        this.id = id;
        this.facultyId = facultyId;
        this.collection = collection;
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.remove("id");
        this.attributes = Collections.unmodifiableMap(copy);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object get(String field) {
        return attributes.get(field);
    }
}
