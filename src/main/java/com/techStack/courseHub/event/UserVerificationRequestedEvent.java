package com.techStack.courseHub.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Published when an existing user asks for their email address to be verified.
 */
@Getter
public class UserVerificationRequestedEvent extends ApplicationEvent {

    private final String uid;
    private final String email;

    // ApplicationEvent already owns "timestamp"
    private final Instant requestedAt;

    public UserVerificationRequestedEvent(Object source, String uid, String email, Instant requestedAt) {
        super(source);
        this.uid = uid;
        this.email = email;
        this.requestedAt = requestedAt;
    }

    @Override
    public String toString() {
        return "UserVerificationRequestedEvent{" +
                "uid='" + uid + '\'' +
                ", requestedAt=" + requestedAt +
                '}';
    }
}
