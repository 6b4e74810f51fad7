package com.techStack.courseHub.exception.resource;

import com.techStack.courseHub.exception.CourseHubException;
import com.techStack.courseHub.exception.ErrorKind;

public class ResourceNotFoundException extends CourseHubException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
