package com.techStack.courseHub.exception.auth;

import com.techStack.courseHub.exception.CourseHubException;
import com.techStack.courseHub.exception.ErrorKind;
import lombok.Getter;

import java.time.Instant;

/**
 * Correctly signed token whose expiry has passed.
 */
@Getter
public class TokenExpiredException extends CourseHubException {

    private final Instant expiredAt;

    public TokenExpiredException(Instant expiredAt, Throwable cause) {
        super(ErrorKind.TOKEN_EXPIRED, "Token expired at " + expiredAt, cause);
        this.expiredAt = expiredAt;
    }
}
