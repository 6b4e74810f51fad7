package com.techStack.courseHub.dto.response;

/**
 * Success envelope of every protected endpoint: {@code {"result": ...}}.
 */
public record ResultResponse<T>(T result) {

    public static <T> ResultResponse<T> of(T result) {
        return new ResultResponse<>(result);
    }
}
