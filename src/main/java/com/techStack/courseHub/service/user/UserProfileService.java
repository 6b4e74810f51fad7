package com.techStack.courseHub.service.user;

import com.techStack.courseHub.config.core.UserProfileProperties;
import com.techStack.courseHub.event.UserVerificationRequestedEvent;
import com.techStack.courseHub.exception.resource.ResourceNotFoundException;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import com.techStack.courseHub.models.user.UserProfile;
import com.techStack.courseHub.repository.store.OperationDeadline;
import com.techStack.courseHub.repository.user.UserProfileRepository;
import com.techStack.courseHub.util.validation.ValidationUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * User Profile Service
 *
 * Owns the profile lifecycle: create on first sign-in, allow-listed updates, hard delete.
 * Each operation runs under one {@link OperationDeadline} covering all of its round trips.
 * The exists-then-write sequences are not atomic; two first-time registrations for the
 * same uid may both report that the profile did not exist. Both write identical content.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileService {

    private final UserProfileRepository userProfileRepository;
    private final UserProfileProperties userProfileProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final OperationDeadline operationDeadline;
    private final Clock clock;

    /* =========================
       Profile Creation
       ========================= */

    /**
     * Creates a Student profile unless one exists.
     *
     * @return true when the profile already existed and nothing was written
     */
    public Mono<Boolean> saveUser(String uid) {
        Mono<Boolean> operation = requireUid(uid)
                .flatMap(id -> userProfileRepository.exists(id)
                        .flatMap(exists -> {
                            if (exists) {
                                log.debug("User {} already registered", id);
                                return Mono.just(true);
                            }
                            return userProfileRepository.save(UserProfile.newStudent(id))
                                    .doOnSuccess(saved -> log.info("✅ Created profile for user {}", id))
                                    .thenReturn(false);
                        }));
        return operationDeadline.bound(operation, "save user " + uid);
    }

    /* =========================
       Profile Retrieval
       ========================= */

    public Mono<UserProfile> getUserById(String uid) {
        return operationDeadline.bound(findExisting(uid), "get user " + uid);
    }

    /* =========================
       Profile Updates
       ========================= */

    /**
     * Merges the allow-listed subset of {@code updates}; other keys are dropped without error
     */
    public Mono<Void> updateUser(String uid, Map<String, ?> updates) {
        Map<String, Object> filtered = ValidationUtils.filterForAllowedKeys(
                updates, userProfileProperties.getAllowedUpdateFields());

        Mono<Void> operation = requireUid(uid)
                .flatMap(id -> userProfileRepository.exists(id)
                        .flatMap(exists -> {
                            if (!exists) {
                                log.info("No user found with ID: {}", id);
                                return Mono.<Void>error(notFound(id));
                            }
                            if (filtered.isEmpty()) {
                                log.debug("Update for user {} carried no allowed fields", id);
                                return Mono.<Void>empty();
                            }
                            return userProfileRepository.update(id, filtered)
                                    .doOnSuccess(v -> log.info("User document with ID: {} updated fields {}",
                                            id, filtered.keySet()));
                        }));
        return operationDeadline.bound(operation, "update user " + uid);
    }

    /* =========================
       Profile Deletion
       ========================= */

    public Mono<Void> deleteUser(String uid) {
        Mono<Void> operation = requireUid(uid)
                .flatMap(id -> userProfileRepository.exists(id)
                        .flatMap(exists -> exists
                                ? userProfileRepository.delete(id)
                                        .doOnSuccess(v -> log.info("User with ID: {} deleted", id))
                                : Mono.<Void>error(notFound(id))));
        return operationDeadline.bound(operation, "delete user " + uid);
    }

    /* =========================
       Verification
       ========================= */

    /**
     * Accepts a verification request for an existing profile with a well-formed email.
     * Delivery of the message is left to listeners of {@link UserVerificationRequestedEvent}.
     */
    public Mono<Boolean> verifyUser(String uid, String email) {
        Mono<Boolean> operation = findExisting(uid)
                .flatMap(profile -> {
                    if (!ValidationUtils.isValidEmail(email)) {
                        return Mono.<Boolean>error(new InvalidInputException("email", "Invalid email address"));
                    }
                    eventPublisher.publishEvent(new UserVerificationRequestedEvent(
                            this, profile.getUid(), email.trim(), clock.instant()));
                    return Mono.just(true);
                });
        return operationDeadline.bound(operation, "verify user " + uid);
    }

    private Mono<UserProfile> findExisting(String uid) {
        return requireUid(uid)
                .flatMap(id -> userProfileRepository.findByUid(id)
                        .switchIfEmpty(Mono.error(notFound(id))));
    }

    private static Mono<String> requireUid(String uid) {
        return StringUtils.isBlank(uid)
                ? Mono.error(new InvalidInputException("uid", "uid must not be blank"))
                : Mono.just(uid.trim());
    }

    private static ResourceNotFoundException notFound(String uid) {
        return new ResourceNotFoundException("User with uid " + uid + " not found");
    }
}
