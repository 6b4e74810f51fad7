package com.techStack.courseHub.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;

/**
 * Error body shared by the exception handler and the authentication entry point.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    int status;
    String error;       // ErrorKind name, or the HTTP reason phrase
    String message;     // Human-readable, never store or token detail
    String field;       // Offending request field (optional)
    String path;
    Instant timestamp;
}
