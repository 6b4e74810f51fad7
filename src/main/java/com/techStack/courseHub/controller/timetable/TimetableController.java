package com.techStack.courseHub.controller.timetable;

import com.techStack.courseHub.dto.request.TimetableEventRequest;
import com.techStack.courseHub.dto.response.ResultResponse;
import com.techStack.courseHub.models.timetable.TimetableEvent;
import com.techStack.courseHub.service.timetable.TimetableEventService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Timetable of the token subject. The uid always comes from the token.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class TimetableController {

    private final TimetableEventService timetableEventService;

    @GetMapping
    public Mono<ResponseEntity<ResultResponse<List<TimetableEvent>>>> listEvents(
            @AuthenticationPrincipal String subjectId) {

        return timetableEventService.listEvents(subjectId)
                .collectList()
                .map(events -> ResponseEntity.ok(ResultResponse.of(events)));
    }

    @PostMapping("/add")
    public Mono<ResponseEntity<ResultResponse<TimetableEvent>>> addEvent(
            @AuthenticationPrincipal String subjectId,
            @RequestBody TimetableEventRequest request) {

        return timetableEventService.addEvent(subjectId, request)
                .map(event -> ResponseEntity.ok(ResultResponse.of(event)));
    }
}
