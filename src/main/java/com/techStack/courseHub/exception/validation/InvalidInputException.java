package com.techStack.courseHub.exception.validation;

import com.techStack.courseHub.exception.CourseHubException;
import com.techStack.courseHub.exception.ErrorKind;
import lombok.Getter;

/**
 * Malformed caller-supplied data: a missing parameter, a non-numeric id, a bad email.
 */
@Getter
public class InvalidInputException extends CourseHubException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(ErrorKind.INVALID_INPUT, message);
        this.field = field;
    }
}
