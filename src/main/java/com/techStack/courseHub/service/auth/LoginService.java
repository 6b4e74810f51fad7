package com.techStack.courseHub.service.auth;

import com.techStack.courseHub.exception.auth.UnauthorizedException;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import com.techStack.courseHub.models.auth.SessionToken;
import com.techStack.courseHub.service.token.TokenService;
import com.techStack.courseHub.util.auth.BasicAuthCredentials;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Operator login: Basic credentials in, session token for the requested uid out.
 *
 * Credentials are checked before the uid, so a caller without valid credentials
 * always sees Unauthorized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private static final String LOGIN_METRIC = "auth.login";

    private final CredentialGate credentialGate;
    private final TokenService tokenService;
    private final MeterRegistry meterRegistry;

    /**
     * @param requestedUid subscribed only once the credentials have been accepted, so an
     *                     unreadable body never masks a credential failure
     */
    public Mono<SessionToken> login(String authorizationHeader, Mono<String> requestedUid) {
        return Mono.fromRunnable(() -> checkCredentials(authorizationHeader))
                .then(requestedUid.defaultIfEmpty(""))
                .map(uid -> {
                    if (StringUtils.isBlank(uid)) {
                        meterRegistry.counter(LOGIN_METRIC, "outcome", "incomplete").increment();
                        throw new InvalidInputException("uid", "Incomplete request");
                    }

                    SessionToken token = tokenService.issue(uid.trim());
                    meterRegistry.counter(LOGIN_METRIC, "outcome", "success").increment();
                    log.info("✅ Login successful for subject {}", token.subjectId());
                    return token;
                });
    }

    private void checkCredentials(String authorizationHeader) {
        BasicAuthCredentials credentials = BasicAuthCredentials.parse(authorizationHeader)
                .orElseThrow(() -> reject("missing or malformed Basic credentials"));

        if (!credentialGate.authenticate(credentials.username(), credentials.password())) {
            throw reject("credentials rejected");
        }
    }

    private UnauthorizedException reject(String reason) {
        meterRegistry.counter(LOGIN_METRIC, "outcome", "rejected").increment();
        log.warn("Login rejected: {}", reason);
        return new UnauthorizedException("Unauthorized");
    }
}
