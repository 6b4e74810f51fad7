package com.techStack.courseHub.exception.service;

import com.techStack.courseHub.exception.CourseHubException;
import com.techStack.courseHub.exception.ErrorKind;

/**
 * Data store failure or request deadline exceeded. The message is safe to return to
 * clients; store-specific detail only travels in the cause.
 */
public class ServiceUnavailableException extends CourseHubException {

    public ServiceUnavailableException(String message) {
        super(ErrorKind.UNAVAILABLE, message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(ErrorKind.UNAVAILABLE, message, cause);
    }
}
