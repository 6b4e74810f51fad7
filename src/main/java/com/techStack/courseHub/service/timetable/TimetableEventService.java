package com.techStack.courseHub.service.timetable;

import com.techStack.courseHub.dto.request.TimetableEventRequest;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import com.techStack.courseHub.models.timetable.TimetableEvent;
import com.techStack.courseHub.repository.store.OperationDeadline;
import com.techStack.courseHub.repository.timetable.TimetableEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Personal timetable of the authenticated user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimetableEventService {

    private final TimetableEventRepository timetableEventRepository;
    private final OperationDeadline operationDeadline;

    public Flux<TimetableEvent> listEvents(String uid) {
        return operationDeadline.bound(timetableEventRepository.findAllByUid(uid), "list events of user " + uid);
    }

    public Mono<TimetableEvent> addEvent(String uid, TimetableEventRequest request) {
        return operationDeadline.bound(Mono.defer(() -> {
            if (request == null) {
                return Mono.error(new InvalidInputException("event", "Event body is required"));
            }
            requireField(request.getTitle(), "title");
            requireField(request.getStart(), "start");
            requireField(request.getEnd(), "end");

            TimetableEvent event = TimetableEvent.builder()
                    .title(request.getTitle().trim())
                    .start(request.getStart().trim())
                    .end(request.getEnd().trim())
                    .extendedProps(request.getExtendedProps() != null ? request.getExtendedProps() : Map.of())
                    .build();

            return timetableEventRepository.add(uid, event)
                    .doOnSuccess(saved -> log.info("Added event {} for user {}", saved.getId(), uid));
        }), "add event for user " + uid);
    }

    private static void requireField(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new InvalidInputException(field, "Event " + field + " is required");
        }
    }
}
