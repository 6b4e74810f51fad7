package com.techStack.courseHub.config.integration;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Firebase Configuration
 *
 * Configures the Firebase App and the Firestore client backing the document store.
 * When FIRESTORE_EMULATOR_HOST is set the SDK talks to the local emulator instead.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(FirestoreProperties.class)
public class FirebaseConfig {

    private final FirestoreProperties properties;

    /* =========================
       Firebase App Configuration
       ========================= */

    @Bean
    public FirebaseApp firebaseApp(Clock clock) throws IOException {
        Instant startTime = clock.instant();

        if (!FirebaseApp.getApps().isEmpty()) {
            log.info("Using existing Firebase application instance");
            return FirebaseApp.getInstance();
        }

        FirebaseOptions options = FirebaseOptions.builder()
                .setCredentials(loadCredentials())
                .setProjectId(properties.getProjectId())
                .build();

        FirebaseApp app = FirebaseApp.initializeApp(options);
        log.info("Firebase application initialized for project {} (duration: {})",
                options.getProjectId(), Duration.between(startTime, clock.instant()));
        return app;
    }

    /**
     * Service account from the classpath, then the filesystem; application default credentials otherwise
     */
    private GoogleCredentials loadCredentials() throws IOException {
        String path = properties.getServiceAccountPath();
        if (StringUtils.isBlank(path)) {
            log.info("No service account configured, using application default credentials");
            return GoogleCredentials.getApplicationDefault();
        }

        InputStream classpathStream = getClass().getClassLoader().getResourceAsStream(path);
        if (classpathStream != null) {
            try (InputStream in = classpathStream) {
                log.debug("Loaded service account from classpath: {}", path);
                return GoogleCredentials.fromStream(in);
            }
        }

        Path file = Path.of(path);
        if (!Files.isReadable(file)) {
            throw new IllegalStateException("Firebase service account file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(file)) {
            log.debug("Loaded service account from file: {}", path);
            return GoogleCredentials.fromStream(in);
        }
    }

    /* =========================
       Firebase Services
       ========================= */

    @Bean
    public Firestore firestore(FirebaseApp firebaseApp) {
        Firestore firestore = FirestoreClient.getFirestore(firebaseApp);
        log.info("Firestore initialized for project {}", properties.getProjectId());
        return firestore;
    }
}
