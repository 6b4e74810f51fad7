package com.techStack.courseHub.dto.response;

public record MessageResponse(String message) {
}
