package com.techStack.courseHub.controller.faculty;

import com.techStack.courseHub.dto.response.ResultResponse;
import com.techStack.courseHub.models.faculty.FacultyCollection;
import com.techStack.courseHub.models.faculty.FacultyScopedItem;
import com.techStack.courseHub.repository.faculty.FacultyCollectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.techStack.courseHub.util.validation.ValidationUtils.requireParameter;

@Slf4j
@RestController
@RequestMapping("/api/programs")
@RequiredArgsConstructor
public class ProgramController {

    private final FacultyCollectionRepository facultyCollectionRepository;

    @GetMapping("/getOneById")
    public Mono<ResponseEntity<ResultResponse<FacultyScopedItem>>> getOneById(
            @RequestParam(required = false) String facultyId,
            @RequestParam(required = false) String programId) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");
        String program = requireParameter(programId, "programId", "No program sent");

        return facultyCollectionRepository.getById(faculty, FacultyCollection.PROGRAMS, program)
                .doOnNext(item -> log.info("Found and sent program with id {} of faculty {}", program, faculty))
                .map(item -> ResponseEntity.ok(ResultResponse.of(item)));
    }

    @GetMapping("/getAllForFaculty")
    public Mono<ResponseEntity<ResultResponse<List<FacultyScopedItem>>>> getAllForFaculty(
            @RequestParam(required = false) String facultyId) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");

        return facultyCollectionRepository.getAll(faculty, FacultyCollection.PROGRAMS)
                .collectList()
                .doOnNext(items -> log.info("Found and sent {} programs of faculty {}", items.size(), faculty))
                .map(items -> ResponseEntity.ok(ResultResponse.of(items)));
    }
}
