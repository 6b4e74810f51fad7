package com.techStack.courseHub.exception.auth;

import com.techStack.courseHub.exception.CourseHubException;
import com.techStack.courseHub.exception.ErrorKind;

/**
 * Missing, malformed or wrongly signed credentials or token.
 */
public class UnauthorizedException extends CourseHubException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(ErrorKind.UNAUTHORIZED, message, cause);
    }
}
