package com.techStack.courseHub.models.faculty;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"id"})
public class Faculty {

    private final String id;
    private final Map<String, Object> attributes;

    public Faculty(String id, Map<String, Object> attributes) {
        this.id = id;
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.remove("id");
        this.attributes = Collections.unmodifiableMap(copy);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
