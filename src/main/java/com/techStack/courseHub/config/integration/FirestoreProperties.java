package com.techStack.courseHub.config.integration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Validated
@ConfigurationProperties(prefix = "firebase")
public class FirestoreProperties {

    @NotBlank(message = "firebase.project-id must not be blank")
    private final String projectId;

    /** Classpath or filesystem location of a service account; blank means application default credentials. */
    private final String serviceAccountPath;

    /** Deadline applied to every single data store round trip. */
    @NotNull
    private final Duration requestTimeout;

    public FirestoreProperties(String projectId,
                               String serviceAccountPath,
                               @DefaultValue("PT540S") Duration requestTimeout) {
        this.projectId = projectId;
        this.serviceAccountPath = serviceAccountPath;
        this.requestTimeout = requestTimeout;
    }
}
