package com.techStack.courseHub.security;

import com.techStack.courseHub.config.security.JwtConfig;
import com.techStack.courseHub.controller.auth.AuthController;
import com.techStack.courseHub.controller.faculty.CourseController;
import com.techStack.courseHub.repository.faculty.FacultyCollectionRepository;
import com.techStack.courseHub.repository.store.CollectionPath;
import com.techStack.courseHub.repository.store.DocumentStore;
import com.techStack.courseHub.repository.store.InMemoryDocumentStore;
import com.techStack.courseHub.repository.store.OperationDeadline;
import com.techStack.courseHub.security.config.CustomAuthenticationEntryPoint;
import com.techStack.courseHub.security.config.SecurityConfig;
import com.techStack.courseHub.service.auth.CredentialGate;
import com.techStack.courseHub.service.auth.LoginService;
import com.techStack.courseHub.service.token.TokenService;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Login, then read a protected collection with the issued cookie, all through the real
 * token service and security chain.
 */
@WebFluxTest(controllers = {AuthController.class, CourseController.class})
@Import({
        SecurityConfig.class,
        CustomAuthenticationEntryPoint.class,
        JwtConfig.class,
        TokenService.class,
        CredentialGate.class,
        LoginService.class,
        FacultyCollectionRepository.class,
        AccessFlowTest.Fixtures.class
})
class AccessFlowTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @TestConfiguration
    static class Fixtures {

        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        OperationDeadline operationDeadline() {
            return new OperationDeadline(Duration.ofSeconds(5));
        }

        @Bean
        DocumentStore documentStore() {
            CollectionPath courses = CollectionPath.root("faculties").subCollection("fac-1", "courses");
            return new InMemoryDocumentStore()
                    .put(courses, "c1", Map.of("name", "Algebra", "programId", 3L))
                    .put(courses, "c2", Map.of("name", "Physics", "programId", 4L));
        }
    }

    @Autowired
    private WebTestClient webTestClient;

    private String login() {
        ResponseCookie cookie = webTestClient.post().uri("/api/auth/login")
                .headers(headers -> headers.setBasicAuth("admin", "s3cret"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("uid", "student-1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .returnResult()
                .getResponseCookies()
                .getFirst("token");

        assertThat(cookie).isNotNull();
        assertThat(cookie.getMaxAge().getSeconds()).isEqualTo(3600);
        return cookie.getValue();
    }

    @Test
    void issuedCookieOpensProtectedEndpoints() {
        String token = login();

        webTestClient.get().uri("/api/courses/getAllForFaculty?facultyId=fac-1")
                .cookie("token", token)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result.length()").isEqualTo(2);

        webTestClient.get().uri("/api/courses/getAllForProgram?facultyId=fac-1&programId=3")
                .cookie("token", token)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result.length()").isEqualTo(1)
                .jsonPath("$.result[0].name").isEqualTo("Algebra");
    }

    @Test
    void wrongCredentialsGetNoCookie() {
        webTestClient.post().uri("/api/auth/login")
                .headers(headers -> headers.setBasicAuth("admin", "wrong"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("uid", "student-1"))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectCookie().doesNotExist("token");
    }

    @Test
    void wrongCredentialsWinOverUnreadableJsonBody() {
        webTestClient.post().uri("/api/auth/login")
                .headers(headers -> headers.setBasicAuth("admin", "wrong"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{not json")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectCookie().doesNotExist("token");
    }

    @Test
    void wrongCredentialsWinOverUnsupportedContentType() {
        webTestClient.post().uri("/api/auth/login")
                .headers(headers -> headers.setBasicAuth("admin", "wrong"))
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue("uid=student-1")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unauthorized");
    }

    @Test
    void missingCredentialsWithBodyAreUnauthorized() {
        webTestClient.post().uri("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("uid", "student-1"))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void validCredentialsWithoutUidAreBadRequest() {
        webTestClient.post().uri("/api/auth/login")
                .headers(headers -> headers.setBasicAuth("admin", "s3cret"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Incomplete request");
    }

    @Test
    void expiredCookieIsRejectedWithExpiryMessage() {
        Instant issuedAt = Instant.now().minusSeconds(7200);
        String expired = Jwts.builder()
                .setSubject("student-1")
                .setIssuer("course-hub")
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(issuedAt.plusSeconds(3600)))
                .signWith(JwtConfig.createSigningKey(SECRET), SignatureAlgorithm.HS256)
                .compact();

        webTestClient.get().uri("/api/courses/getAllForFaculty?facultyId=fac-1")
                .cookie("token", expired)
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Token has expired");
    }

    @Test
    void noCookieIsUnauthorized() {
        webTestClient.get().uri("/api/courses/getAllForFaculty?facultyId=fac-1")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unauthorized");
    }
}
