package com.techStack.courseHub.exception;

/**
 * Closed set of failure kinds raised by the access-control and data-access layers.
 * The web layer is the only place that turns a kind into an HTTP status.
 */
public enum ErrorKind {
    UNAUTHORIZED,
    TOKEN_EXPIRED,
    NOT_FOUND,
    INVALID_INPUT,
    UNAVAILABLE
}
