package com.techStack.courseHub.controller.auth;

import com.techStack.courseHub.config.core.AppConfig;
import com.techStack.courseHub.config.security.JwtConfig;
import com.techStack.courseHub.exception.auth.UnauthorizedException;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import com.techStack.courseHub.models.auth.SessionToken;
import com.techStack.courseHub.security.config.CustomAuthenticationEntryPoint;
import com.techStack.courseHub.security.config.SecurityConfig;
import com.techStack.courseHub.service.auth.LoginService;
import com.techStack.courseHub.service.token.TokenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = AuthController.class)
@Import({SecurityConfig.class, CustomAuthenticationEntryPoint.class, JwtConfig.class, AppConfig.class})
class AuthControllerTest {

    private static final String BASIC = "Basic YWRtaW46czNjcmV0";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private LoginService loginService;

    @MockBean
    private TokenService tokenService;

    /**
     * Issues a token named after the uid the controller extracted, or fails like the real
     * service when none was sent.
     */
    private void acceptLoginIssuing(String tokenValue) {
        Instant issuedAt = Instant.parse("2024-03-01T10:00:00Z");
        when(loginService.login(eq(BASIC), any())).thenAnswer(invocation -> {
            Mono<String> uid = invocation.getArgument(1);
            return uid.defaultIfEmpty("").flatMap(value -> value.isBlank()
                    ? Mono.error(new InvalidInputException("uid", "Incomplete request"))
                    : Mono.just(new SessionToken(tokenValue, value, issuedAt, issuedAt.plusSeconds(3600))));
        });
    }

    @Test
    void successfulLoginSetsSessionCookie() {
        acceptLoginIssuing("signed.jwt.value");

        webTestClient.post().uri("/api/auth/login")
                .header(HttpHeaders.AUTHORIZATION, BASIC)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("uid", "student-1"))
                .exchange()
                .expectStatus().isOk()
                .expectCookie().valueEquals("token", "signed.jwt.value")
                .expectCookie().httpOnly("token", true)
                .expectCookie().secure("token", true)
                .expectCookie().sameSite("token", "Strict")
                .expectCookie().path("token", "/")
                .expectBody()
                .jsonPath("$.message").isEqualTo("Login successful");
    }

    @Test
    void rejectedCredentialsAreUnauthorized() {
        when(loginService.login(any(), any())).thenReturn(Mono.error(new UnauthorizedException("Unauthorized")));

        webTestClient.post().uri("/api/auth/login")
                .header(HttpHeaders.AUTHORIZATION, "Basic d3Jvbmc6d3Jvbmc=")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("uid", "student-1"))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectHeader().doesNotExist(HttpHeaders.SET_COOKIE)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unauthorized");
    }

    @Test
    void missingUidIsBadRequest() {
        acceptLoginIssuing("unused");

        webTestClient.post().uri("/api/auth/login")
                .header(HttpHeaders.AUTHORIZATION, BASIC)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Incomplete request")
                .jsonPath("$.field").isEqualTo("uid");
    }

    @Test
    void onlyPostIsAllowed() {
        webTestClient.get().uri("/api/auth/login")
                .exchange()
                .expectStatus().isEqualTo(405);
    }

    @Test
    void unreadableBodyWithValidCredentialsIsBadRequest() {
        acceptLoginIssuing("unused");

        webTestClient.post().uri("/api/auth/login")
                .header(HttpHeaders.AUTHORIZATION, BASIC)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{not json")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Incomplete request");
    }

    @Test
    void staleCookieDoesNotBlockLogin() {
        acceptLoginIssuing("fresh.jwt.value");

        webTestClient.post().uri("/api/auth/login")
                .cookie("token", "expired.jwt.value")
                .header(HttpHeaders.AUTHORIZATION, BASIC)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("uid", "student-1"))
                .exchange()
                .expectStatus().isOk()
                .expectCookie().valueEquals("token", "fresh.jwt.value");

        verify(tokenService, never()).verify(anyString());
    }
}
