package com.techStack.courseHub.repository.faculty;

import com.techStack.courseHub.exception.resource.ResourceNotFoundException;
import com.techStack.courseHub.exception.validation.InvalidInputException;
import com.techStack.courseHub.models.faculty.FacultyCollection;
import com.techStack.courseHub.models.faculty.FacultyScopedItem;
import com.techStack.courseHub.repository.store.CollectionPath;
import com.techStack.courseHub.repository.store.InMemoryDocumentStore;
import com.techStack.courseHub.repository.store.OperationDeadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FacultyCollectionRepositoryTest {

    private static final CollectionPath FACULTIES = CollectionPath.root("faculties");
    private static final CollectionPath COURSES = FACULTIES.subCollection("fac-1", "courses");
    private static final CollectionPath BRANCHES = FACULTIES.subCollection("fac-1", "branches");

    private InMemoryDocumentStore store;
    private FacultyCollectionRepository repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore()
                .put(FACULTIES, "fac-1", Map.of("name", "Engineering"))
                .put(FACULTIES, "fac-2", Map.of("name", "Medicine"))
                .put(COURSES, "c1", Map.of("name", "Algebra", "programId", 3, "branchId", 10L))
                .put(COURSES, "c2", Map.of("name", "Physics", "programId", 3.0, "branchId", 11L))
                .put(COURSES, "c3", Map.of("name", "Chemistry", "programId", "3"))
                .put(COURSES, "c4", Map.of("name", "Biology", "programId", 4L))
                .put(BRANCHES, "b1", Map.of("name", "Software", "programId", 3L, "year", 2L))
                .put(BRANCHES, "b2", Map.of("name", "Hardware", "programId", 3L, "year", 3L));
        repository = new FacultyCollectionRepository(store, new OperationDeadline(Duration.ofSeconds(5)));
    }

    @Test
    void listsFaculties() {
        StepVerifier.create(repository.getFaculties().map(faculty -> faculty.getId()).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("fac-1", "fac-2"))
                .verifyComplete();
    }

    @Test
    void getAllReturnsEveryItemWithItsId() {
        StepVerifier.create(repository.getAll("fac-1", FacultyCollection.COURSES).collectList())
                .assertNext(items -> {
                    assertThat(items).extracting(FacultyScopedItem::getId).containsExactly("c1", "c2", "c3", "c4");
                    assertThat(items.get(0).get("name")).isEqualTo("Algebra");
                    assertThat(items.get(0).getFacultyId()).isEqualTo("fac-1");
                })
                .verifyComplete();
    }

    @Test
    void getAllOfUnknownFacultyIsEmpty() {
        StepVerifier.create(repository.getAll("unknown", FacultyCollection.PROGRAMS))
                .verifyComplete();
    }

    @Test
    void getByIdFindsItem() {
        StepVerifier.create(repository.getById("fac-1", FacultyCollection.COURSES, "c2"))
                .assertNext(item -> {
                    assertThat(item.getId()).isEqualTo("c2");
                    assertThat(item.getCollection()).isEqualTo(FacultyCollection.COURSES);
                    assertThat(item.get("name")).isEqualTo("Physics");
                })
                .verifyComplete();
    }

    @Test
    void getByIdOfMissingItemIsNotFound() {
        StepVerifier.create(repository.getById("fac-1", FacultyCollection.COURSES, "missing"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(ResourceNotFoundException.class)
                        .hasMessageContaining("missing"))
                .verify();
    }

    @Test
    void idsContainingSlashAreInvalidInput() {
        StepVerifier.create(repository.getById("fac-1", FacultyCollection.COURSES, "c1/../c2"))
                .expectError(InvalidInputException.class)
                .verify();
        StepVerifier.create(repository.getAll("fac-1/courses", FacultyCollection.COURSES))
                .expectError(InvalidInputException.class)
                .verify();
    }

    @Test
    void relativeAndReservedIdsAreInvalidInput() {
        StepVerifier.create(repository.getById("fac-1", FacultyCollection.COURSES, ".."))
                .expectError(InvalidInputException.class)
                .verify();
        StepVerifier.create(repository.getById("fac-1", FacultyCollection.COURSES, "__name__"))
                .expectError(InvalidInputException.class)
                .verify();
        StepVerifier.create(repository.getAll(".", FacultyCollection.BRANCHES))
                .expectError(InvalidInputException.class)
                .verify();
    }

    @Test
    void numericFilterMatchesEveryNumericRepresentationButNotStrings() {
        StepVerifier.create(repository.getByFilter("fac-1", FacultyCollection.COURSES, "programId", 3L)
                        .map(FacultyScopedItem::getId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("c1", "c2"))
                .verifyComplete();
    }

    @Test
    void filterWithoutMatchesIsEmpty() {
        StepVerifier.create(repository.getByFilter("fac-1", FacultyCollection.COURSES, "branchId", 99L))
                .verifyComplete();
    }

    @Test
    void combinedFiltersMustAllMatch() {
        StepVerifier.create(repository.getByFilters("fac-1", FacultyCollection.BRANCHES,
                                Map.of("programId", 3L, "year", 3L))
                        .map(FacultyScopedItem::getId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactly("b2"))
                .verifyComplete();
    }

    @Test
    void emptyFilterSetIsInvalidInput() {
        StepVerifier.create(repository.getByFilters("fac-1", FacultyCollection.BRANCHES, Map.of()))
                .expectError(InvalidInputException.class)
                .verify();
    }
}
