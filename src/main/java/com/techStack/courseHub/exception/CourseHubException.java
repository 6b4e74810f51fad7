package com.techStack.courseHub.exception;

import lombok.Getter;

/**
 * Base type for every domain failure. Subclasses fix the {@link ErrorKind};
 * callers switch on {@link #getKind()} rather than comparing messages.
 */
@Getter
public abstract class CourseHubException extends RuntimeException {

    private final ErrorKind kind;

    protected CourseHubException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CourseHubException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "kind=" + kind +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
