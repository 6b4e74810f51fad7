package com.techStack.courseHub.controller.faculty;

import com.techStack.courseHub.dto.response.ResultResponse;
import com.techStack.courseHub.models.faculty.Faculty;
import com.techStack.courseHub.repository.faculty.FacultyCollectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/faculties")
@RequiredArgsConstructor
public class FacultyController {

    private final FacultyCollectionRepository facultyCollectionRepository;

    @GetMapping
    public Mono<ResponseEntity<ResultResponse<List<Faculty>>>> getAll() {
        return facultyCollectionRepository.getFaculties()
                .collectList()
                .doOnNext(faculties -> log.info("Found and sent {} faculties", faculties.size()))
                .map(faculties -> ResponseEntity.ok(ResultResponse.of(faculties)));
    }
}
