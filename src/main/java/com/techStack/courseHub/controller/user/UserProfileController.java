package com.techStack.courseHub.controller.user;

import com.techStack.courseHub.dto.request.VerifyUserRequest;
import com.techStack.courseHub.dto.response.ResultResponse;
import com.techStack.courseHub.models.user.UserProfile;
import com.techStack.courseHub.service.user.UserProfileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * User Profile Controller
 *
 * Registration of the signed-in user plus profile CRUD.
 */
@Slf4j
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserProfileController {

    private final UserProfileService userProfileService;

    /**
     * Registers the token subject; {@code existed} tells whether the profile was already there
     */
    @PostMapping
    public Mono<ResponseEntity<ResultResponse<Map<String, Boolean>>>> saveUser(
            @AuthenticationPrincipal String subjectId) {

        return userProfileService.saveUser(subjectId)
                .map(existed -> ResponseEntity.ok(ResultResponse.of(Map.of("existed", existed))));
    }

    @GetMapping("/{uid}")
    public Mono<ResponseEntity<ResultResponse<UserProfile>>> getUser(@PathVariable String uid) {
        return userProfileService.getUserById(uid)
                .map(profile -> ResponseEntity.ok(ResultResponse.of(profile)));
    }

    @PatchMapping("/{uid}")
    public Mono<ResponseEntity<ResultResponse<String>>> updateUser(
            @PathVariable String uid,
            @RequestBody Map<String, Object> updates) {

        return userProfileService.updateUser(uid, updates)
                .thenReturn(ResponseEntity.ok(ResultResponse.of("User " + uid + " updated successfully")));
    }

    @DeleteMapping("/{uid}")
    public Mono<ResponseEntity<ResultResponse<String>>> deleteUser(@PathVariable String uid) {
        return userProfileService.deleteUser(uid)
                .thenReturn(ResponseEntity.ok(ResultResponse.of("User deleted successfully")));
    }

    @PostMapping("/{uid}/verify")
    public Mono<ResponseEntity<ResultResponse<Boolean>>> verifyUser(
            @PathVariable String uid,
            @RequestBody VerifyUserRequest request) {

        return userProfileService.verifyUser(uid, request.getEmail())
                .map(verified -> ResponseEntity.ok(ResultResponse.of(verified)));
    }
}
