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

import static com.techStack.courseHub.util.validation.ValidationUtils.parseNumericParameter;
import static com.techStack.courseHub.util.validation.ValidationUtils.requireParameter;

/**
 * Courses of a faculty, whole or narrowed to a program or branch.
 */
@Slf4j
@RestController
@RequestMapping("/api/courses")
@RequiredArgsConstructor
public class CourseController {

    private final FacultyCollectionRepository facultyCollectionRepository;

    /**
     * Query Parameters:
     * - facultyId: faculty the course belongs to
     * - courseId: course to retrieve
     */
    @GetMapping("/getOneById")
    public Mono<ResponseEntity<ResultResponse<FacultyScopedItem>>> getOneById(
            @RequestParam(required = false) String facultyId,
            @RequestParam(required = false) String courseId) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");
        String course = requireParameter(courseId, "courseId", "No course sent");

        return facultyCollectionRepository.getById(faculty, FacultyCollection.COURSES, course)
                .doOnNext(item -> log.info("Found and sent course with id {} of faculty {}", course, faculty))
                .map(item -> ResponseEntity.ok(ResultResponse.of(item)));
    }

    @GetMapping("/getAllForFaculty")
    public Mono<ResponseEntity<ResultResponse<List<FacultyScopedItem>>>> getAllForFaculty(
            @RequestParam(required = false) String facultyId) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");

        return facultyCollectionRepository.getAll(faculty, FacultyCollection.COURSES)
                .collectList()
                .doOnNext(items -> log.info("Found and sent {} courses of faculty {}", items.size(), faculty))
                .map(items -> ResponseEntity.ok(ResultResponse.of(items)));
    }

    @GetMapping("/getAllForProgram")
    public Mono<ResponseEntity<ResultResponse<List<FacultyScopedItem>>>> getAllForProgram(
            @RequestParam(required = false) String facultyId,
            @RequestParam(required = false) String programId) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");
        long program = parseNumericParameter(requireParameter(programId, "programId", "No program sent"), "programId");

        return facultyCollectionRepository.getByFilter(faculty, FacultyCollection.COURSES, "programId", program)
                .collectList()
                .doOnNext(items -> log.info("Found and sent {} courses for program {} of faculty {}",
                        items.size(), program, faculty))
                .map(items -> ResponseEntity.ok(ResultResponse.of(items)));
    }

    @GetMapping("/getAllForBranch")
    public Mono<ResponseEntity<ResultResponse<List<FacultyScopedItem>>>> getAllForBranch(
            @RequestParam(required = false) String facultyId,
            @RequestParam(required = false) String branchId) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");
        long branch = parseNumericParameter(requireParameter(branchId, "branchId", "No branch sent"), "branchId");

        return facultyCollectionRepository.getByFilter(faculty, FacultyCollection.COURSES, "branchId", branch)
                .collectList()
                .doOnNext(items -> log.info("Found and sent {} courses for branch {} of faculty {}",
                        items.size(), branch, faculty))
                .map(items -> ResponseEntity.ok(ResultResponse.of(items)));
    }
}
