package com.techStack.courseHub.util.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Username and password carried by an {@code Authorization: Basic} header.
 */
public record BasicAuthCredentials(String username, String password) {

    private static final String BASIC_PREFIX = "Basic ";

    /**
     * @return empty when the header is absent, not Basic, not Base64 or has no ':' separator
     */
    public static Optional<BasicAuthCredentials> parse(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BASIC_PREFIX)) {
            return Optional.empty();
        }

        String decoded;
        try {
            byte[] raw = Base64.getDecoder().decode(authorizationHeader.substring(BASIC_PREFIX.length()).trim());
            decoded = new String(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        // Passwords may themselves contain ':'
        int separator = decoded.indexOf(':');
        if (separator < 0) {
            return Optional.empty();
        }
        return Optional.of(new BasicAuthCredentials(decoded.substring(0, separator), decoded.substring(separator + 1)));
    }

    @Override
    public String toString() {
        return "BasicAuthCredentials{username='" + username + "', password='***'}";
    }
}
