package com.techStack.courseHub.models.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Signed bearer token issued for one subject. Only the token service creates these.
 *
 * @param value     compact JWS handed to the client
 * @param subjectId identity the token was issued for
 */
public record SessionToken(String value, String subjectId, Instant issuedAt, Instant expiresAt) {

    public Duration lifetime() {
        return Duration.between(issuedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "SessionToken{subjectId='" + subjectId + "', issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + '}';
    }
}
