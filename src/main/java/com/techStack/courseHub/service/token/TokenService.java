package com.techStack.courseHub.service.token;

import com.techStack.courseHub.config.security.AccessControlProperties;
import com.techStack.courseHub.exception.auth.TokenExpiredException;
import com.techStack.courseHub.exception.auth.UnauthorizedException;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import com.techStack.courseHub.models.auth.SessionToken;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Issues and verifies the HS256 session tokens handed out at login.
 *
 * Verification reports an expired but correctly signed token as {@link TokenExpiredException}
 * and every other failure as {@link UnauthorizedException}. Tokens cannot be revoked before
 * they expire.
 */
@Slf4j
@Service
public class TokenService {

    private static final String VERIFY_METRIC = "auth.token.verify";
    private static final String OUTCOME_TAG = "outcome";

    private final SecretKey signingKey;
    private final Duration tokenTtl;
    private final String issuer;
    private final Clock clock;
    private final JwtParser parser;
    private final MeterRegistry meterRegistry;

    public TokenService(SecretKey tokenSigningKey,
                        AccessControlProperties properties,
                        Clock clock,
                        MeterRegistry meterRegistry) {
        this.signingKey = tokenSigningKey;
        this.tokenTtl = properties.getTokenTtl();
        this.issuer = properties.getIssuer();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(tokenSigningKey)
                .requireIssuer(issuer)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Signs a token for the given subject, valid for the configured lifetime
     */
    public SessionToken issue(String subjectId) {
        if (StringUtils.isBlank(subjectId)) {
            throw new InvalidInputException("uid", "Subject id must not be blank");
        }

        // JWT dates have second precision
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(tokenTtl);

        String value = Jwts.builder()
                .setSubject(subjectId)
                .setIssuer(issuer)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();

        log.info("Issued session token for subject {} valid until {}", subjectId, expiresAt);
        return new SessionToken(value, subjectId, issuedAt, expiresAt);
    }

    /**
     * @return the subject the token was issued for
     */
    public String verify(String presentedToken) {
        if (StringUtils.isBlank(presentedToken)) {
            record("invalid");
            throw new UnauthorizedException("No token presented");
        }

        Claims claims;
        try {
            claims = parser.parseClaimsJws(presentedToken.trim()).getBody();
        } catch (ExpiredJwtException e) {
            record("expired");
            throw new TokenExpiredException(e.getClaims().getExpiration().toInstant(), e);
        } catch (JwtException | IllegalArgumentException e) {
            record("invalid");
            log.debug("Rejected token: {}", e.getMessage());
            throw new UnauthorizedException("Invalid token", e);
        }

        // The parser only rejects tokens strictly past their expiry
        Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : null;
        if (expiresAt == null) {
            record("invalid");
            throw new UnauthorizedException("Token carries no expiry");
        }
        if (!clock.instant().isBefore(expiresAt)) {
            record("expired");
            throw new TokenExpiredException(expiresAt, null);
        }

        String subject = claims.getSubject();
        if (StringUtils.isBlank(subject)) {
            record("invalid");
            throw new UnauthorizedException("Token carries no subject");
        }

        record("valid");
        return subject;
    }

    private void record(String outcome) {
        meterRegistry.counter(VERIFY_METRIC, OUTCOME_TAG, outcome).increment();
    }
}
