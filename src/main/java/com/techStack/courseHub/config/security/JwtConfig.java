package com.techStack.courseHub.config.security;

import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

@Slf4j
@Configuration
@EnableConfigurationProperties(AccessControlProperties.class)
public class JwtConfig {

    /** HS256 needs at least 256 bits of key material. */
    static final int MIN_KEY_BYTES = 32;

    @Bean
    public SecretKey tokenSigningKey(AccessControlProperties properties) {
        SecretKey key = createSigningKey(properties.getSecretKey());
        log.info("Token signing key initialized ({} bits)", key.getEncoded().length * 8);
        return key;
    }

    public static SecretKey createSigningKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("auth.secret-key must not be null or empty");
        }

        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalArgumentException(
                    String.format("auth.secret-key must be at least 256 bits (32 bytes). Current size: %d bits",
                            keyBytes.length * 8));
        }

        return Keys.hmacShaKeyFor(keyBytes);
    }
}
