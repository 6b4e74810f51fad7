package com.techStack.courseHub.controller.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.courseHub.config.security.AccessControlProperties;
import com.techStack.courseHub.dto.request.LoginRequest;
import com.techStack.courseHub.dto.response.MessageResponse;
import com.techStack.courseHub.service.auth.LoginService;
import com.techStack.courseHub.util.auth.TokenTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Operator login. Only POST is mapped, so any other method is answered with 405.
 *
 * The body is taken as raw text whatever its content type and parsed only after the
 * credentials pass; a body that is not a readable login request counts as a missing uid.
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final LoginService loginService;
    private final AccessControlProperties accessControlProperties;
    private final ObjectMapper objectMapper;

    @PostMapping("/login")
    public Mono<ResponseEntity<MessageResponse>> login(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) Mono<String> body,
            ServerHttpResponse response) {

        return loginService.login(authorization, body.map(this::readUid))
                .map(token -> {
                    ResponseCookie cookie = TokenTransport.tokenCookie(accessControlProperties.getCookieName(), token);
                    response.addCookie(cookie);
                    return ResponseEntity.ok(new MessageResponse("Login successful"));
                });
    }

    private String readUid(String body) {
        try {
            LoginRequest request = objectMapper.readValue(body, LoginRequest.class);
            return request != null && request.getUid() != null ? request.getUid() : "";
        } catch (JsonProcessingException e) {
            log.debug("Unreadable login body: {}", e.getOriginalMessage());
            return "";
        }
    }
}
