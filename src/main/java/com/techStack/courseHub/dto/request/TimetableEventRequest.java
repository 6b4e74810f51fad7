package com.techStack.courseHub.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimetableEventRequest {
    private String title;
    private String start;
    private String end;
    private Map<String, Object> extendedProps;
}
