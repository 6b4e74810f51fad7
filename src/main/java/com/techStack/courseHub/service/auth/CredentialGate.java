package com.techStack.courseHub.service.auth;

import com.techStack.courseHub.config.security.AccessControlProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks a username/password pair against the single configured operator credential.
 *
 * Both fields are always compared in constant time and the result does not say which
 * one was wrong.
 */
@Component
public class CredentialGate {

    private final byte[] expectedUsername;
    private final byte[] expectedPassword;

    public CredentialGate(AccessControlProperties properties) {
        this.expectedUsername = bytes(properties.getUsername());
        this.expectedPassword = bytes(properties.getPassword());
    }

    public boolean authenticate(String username, String password) {
        boolean usernameMatches = MessageDigest.isEqual(bytes(username), expectedUsername);
        boolean passwordMatches = MessageDigest.isEqual(bytes(password), expectedPassword);
        return usernameMatches & passwordMatches;
    }

    private static byte[] bytes(String value) {
        return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    }
}
