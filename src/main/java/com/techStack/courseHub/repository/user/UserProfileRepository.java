package com.techStack.courseHub.repository.user;

import com.techStack.courseHub.constants.CollectionConstants;
import com.techStack.courseHub.models.user.UserProfile;
import com.techStack.courseHub.repository.store.CollectionPath;
import com.techStack.courseHub.repository.store.DocumentStore;
import com.techStack.courseHub.util.validation.ValidationUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Profiles at {@code users/{uid}}. Lookups return an empty Mono for unknown uids;
 * the service decides what that means.
 */
@Repository
@RequiredArgsConstructor
public class UserProfileRepository {

    private static final CollectionPath USERS = CollectionPath.root(CollectionConstants.COLLECTION_USERS);

    private final DocumentStore documentStore;

    public Mono<UserProfile> findByUid(String uid) {
        return Mono.defer(() -> documentStore.get(USERS, ValidationUtils.requirePathSegment(uid, "uid"))
                .map(document -> UserProfile.fromDocument(document.id(), document.data())));
    }

    public Mono<Boolean> exists(String uid) {
        return findByUid(uid).hasElement();
    }

    public Mono<UserProfile> save(UserProfile profile) {
        return Mono.defer(() -> documentStore.set(USERS, ValidationUtils.requirePathSegment(profile.getUid(), "uid"),
                        profile.toDocument()))
                .thenReturn(profile);
    }

    public Mono<Void> update(String uid, Map<String, Object> fields) {
        return Mono.defer(() -> documentStore.update(USERS, ValidationUtils.requirePathSegment(uid, "uid"), fields));
    }

    public Mono<Void> delete(String uid) {
        return Mono.defer(() -> documentStore.delete(USERS, ValidationUtils.requirePathSegment(uid, "uid")));
    }
}
