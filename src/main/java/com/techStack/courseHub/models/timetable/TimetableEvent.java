package com.techStack.courseHub.models.timetable;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Personal timetable entry stored at {@code users/{uid}/events/{id}}.
 */
@Value
@Builder(toBuilder = true)
public class TimetableEvent {

    String id;
    String title;
    String start;
    String end;
    Map<String, Object> extendedProps;

    @SuppressWarnings("unchecked")
    public static TimetableEvent fromDocument(String id, Map<String, Object> data) {
        Object props = data.get("extendedProps");
        return TimetableEvent.builder()
                .id(id)
                .title(asString(data.get("title")))
                .start(asString(data.get("start")))
                .end(asString(data.get("end")))
                .extendedProps(props instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of())
                .build();
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("title", title);
        document.put("start", start);
        document.put("end", end);
        document.put("extendedProps", extendedProps != null ? extendedProps : Map.of());
        return document;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
