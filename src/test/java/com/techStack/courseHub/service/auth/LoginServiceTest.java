package com.techStack.courseHub.service.auth;

import com.techStack.courseHub.config.security.AccessControlProperties;
import com.techStack.courseHub.config.security.JwtConfig;
import com.techStack.courseHub.exception.auth.UnauthorizedException;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import com.techStack.courseHub.service.token.TokenService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class LoginServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    private TokenService tokenService;
    private SimpleMeterRegistry meterRegistry;
    private LoginService loginService;

    @BeforeEach
    void setUp() {
        AccessControlProperties properties = new AccessControlProperties(
                "admin", "s3cret", SECRET, Duration.ofHours(1), "token", "course-hub");
        meterRegistry = new SimpleMeterRegistry();
        tokenService = new TokenService(JwtConfig.createSigningKey(SECRET), properties, Clock.systemUTC(), meterRegistry);
        loginService = new LoginService(new CredentialGate(properties), tokenService, meterRegistry);
    }

    private static String basic(String username, String password) {
        return "Basic " + Base64.getEncoder()
                .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void validCredentialsIssueTokenForRequestedUid() {
        StepVerifier.create(loginService.login(basic("admin", "s3cret"), Mono.just("student-7")))
                .assertNext(token -> {
                    assertThat(token.subjectId()).isEqualTo("student-7");
                    assertThat(tokenService.verify(token.value())).isEqualTo("student-7");
                })
                .verifyComplete();

        assertThat(meterRegistry.counter("auth.login", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void wrongPasswordIsUnauthorized() {
        StepVerifier.create(loginService.login(basic("admin", "nope"), Mono.just("student-7")))
                .expectError(UnauthorizedException.class)
                .verify();

        assertThat(meterRegistry.counter("auth.login", "outcome", "rejected").count()).isEqualTo(1.0);
    }

    @Test
    void missingHeaderIsUnauthorized() {
        StepVerifier.create(loginService.login(null, Mono.just("student-7")))
                .expectError(UnauthorizedException.class)
                .verify();
    }

    @Test
    void nonBasicHeaderIsUnauthorized() {
        StepVerifier.create(loginService.login("Bearer abc", Mono.just("student-7")))
                .expectError(UnauthorizedException.class)
                .verify();
    }

    @Test
    void missingUidWithValidCredentialsIsInvalidInput() {
        StepVerifier.create(loginService.login(basic("admin", "s3cret"), Mono.just(" ")))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(InvalidInputException.class)
                        .hasMessage("Incomplete request"))
                .verify();
    }

    @Test
    void credentialsAreCheckedBeforeUid() {
        StepVerifier.create(loginService.login(basic("admin", "nope"), Mono.empty()))
                .expectError(UnauthorizedException.class)
                .verify();
    }

    @Test
    void requestedUidIsNotReadWhenCredentialsFail() {
        Mono<String> unreadable = Mono.error(new IllegalStateException("body must not be read"));

        StepVerifier.create(loginService.login(basic("admin", "nope"), unreadable))
                .expectError(UnauthorizedException.class)
                .verify();
    }

    @Test
    void emptyBodyWithValidCredentialsIsInvalidInput() {
        StepVerifier.create(loginService.login(basic("admin", "s3cret"), Mono.empty()))
                .expectError(InvalidInputException.class)
                .verify();
    }
}
