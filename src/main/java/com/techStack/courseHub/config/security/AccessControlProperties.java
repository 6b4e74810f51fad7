package com.techStack.courseHub.config.security;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Administrative credential and token settings.
 *
 * Bound once at start-up through the constructor and never mutated afterwards, so a single
 * instance is shared by the credential gate and the token service without locking.
 */
@Getter
@Validated
@ConfigurationProperties(prefix = "auth")
public class AccessControlProperties {

    @NotBlank(message = "auth.username must not be blank")
    private final String username;

    @NotBlank(message = "auth.password must not be blank")
    private final String password;

    @NotBlank(message = "auth.secret-key must not be blank")
    @Size(min = 32, message = "auth.secret-key must be at least 32 characters")
    private final String secretKey;

    @NotNull
    private final Duration tokenTtl;

    @NotBlank
    private final String cookieName;

    @NotBlank
    private final String issuer;

    public AccessControlProperties(String username,
                                   String password,
                                   String secretKey,
                                   @DefaultValue("PT1H") Duration tokenTtl,
                                   @DefaultValue("token") String cookieName,
                                   @DefaultValue("course-hub") String issuer) {
        this.username = username;
        this.password = password;
        this.secretKey = secretKey;
        this.tokenTtl = tokenTtl;
        this.cookieName = cookieName;
        this.issuer = issuer;
    }

    // Secrets stay out of logs and actuator output.
    @Override
    public String toString() {
        return "AccessControlProperties{" +
                "username='***'" +
                ", tokenTtl=" + tokenTtl +
                ", cookieName='" + cookieName + '\'' +
                ", issuer='" + issuer + '\'' +
                '}';
    }
}
