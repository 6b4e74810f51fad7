package com.techStack.courseHub.repository.timetable;

import com.techStack.courseHub.constants.CollectionConstants;
import com.techStack.courseHub.models.timetable.TimetableEvent;
import com.techStack.courseHub.repository.store.CollectionPath;
import com.techStack.courseHub.repository.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
@RequiredArgsConstructor
public class TimetableEventRepository {

    private final DocumentStore documentStore;

    public Flux<TimetableEvent> findAllByUid(String uid) {
        return Flux.defer(() -> documentStore.list(eventsOf(uid))
                .map(document -> TimetableEvent.fromDocument(document.id(), document.data())));
    }

    public Mono<TimetableEvent> add(String uid, TimetableEvent event) {
        return Mono.defer(() -> documentStore.add(eventsOf(uid), event.toDocument())
                .map(id -> event.toBuilder().id(id).build()));
    }

    private static CollectionPath eventsOf(String uid) {
        return CollectionPath.root(CollectionConstants.COLLECTION_USERS)
                .subCollection(uid, CollectionConstants.COLLECTION_USER_EVENTS);
    }
}
