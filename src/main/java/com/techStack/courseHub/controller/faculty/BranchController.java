package com.techStack.courseHub.controller.faculty;

import com.techStack.courseHub.dto.response.ResultResponse;
import com.techStack.courseHub.models.faculty.FacultyCollection;
import com.techStack.courseHub.models.faculty.FacultyScopedItem;
import com.techStack.courseHub.repository.faculty.FacultyCollectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.techStack.courseHub.util.validation.ValidationUtils.parseNumericParameter;
import static com.techStack.courseHub.util.validation.ValidationUtils.requireParameter;

@Slf4j
@RestController
@RequestMapping("/api/branches")
@RequiredArgsConstructor
public class BranchController {

    private final FacultyCollectionRepository facultyCollectionRepository;

    @GetMapping("/getOneById")
    public Mono<ResponseEntity<ResultResponse<FacultyScopedItem>>> getOneById(
            @RequestParam(required = false) String facultyId,
            @RequestParam(required = false) String branchId) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");
        String branch = requireParameter(branchId, "branchId", "No branch sent");

        return facultyCollectionRepository.getById(faculty, FacultyCollection.BRANCHES, branch)
                .map(item -> ResponseEntity.ok(ResultResponse.of(item)));
    }

    @GetMapping("/getAllForFaculty")
    public Mono<ResponseEntity<ResultResponse<List<FacultyScopedItem>>>> getAllForFaculty(
            @RequestParam(required = false) String facultyId) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");

        return facultyCollectionRepository.getAll(faculty, FacultyCollection.BRANCHES)
                .collectList()
                .doOnNext(items -> log.info("Found and sent {} branches of faculty {}", items.size(), faculty))
                .map(items -> ResponseEntity.ok(ResultResponse.of(items)));
    }

    /**
     * Branches of a program, optionally narrowed to one study year
     */
    @GetMapping("/getAllForProgram")
    public Mono<ResponseEntity<ResultResponse<List<FacultyScopedItem>>>> getAllForProgram(
            @RequestParam(required = false) String facultyId,
            @RequestParam(required = false) String programId,
            @RequestParam(required = false) String year) {

        String faculty = requireParameter(facultyId, "facultyId", "No faculty ID sent");
        Map<String, Long> filters = new LinkedHashMap<>();
        filters.put("programId",
                parseNumericParameter(requireParameter(programId, "programId", "No program sent"), "programId"));
        if (StringUtils.isNotBlank(year)) {
            filters.put("year", parseNumericParameter(year, "year"));
        }

        return facultyCollectionRepository.getByFilters(faculty, FacultyCollection.BRANCHES, filters)
                .collectList()
                .doOnNext(items -> log.info("Found and sent {} branches matching {} of faculty {}",
                        items.size(), filters, faculty))
                .map(items -> ResponseEntity.ok(ResultResponse.of(items)));
    }
}
