package org.seatplan.problem;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SeatingProblemTest {

    private static final List<Person> PEOPLE = List.of(
            new Person("A", "B"), new Person("B"), new Person("C"), new Person("D"));

    @Test
    void validate_acceptsConsistentProblem() {
        SeatingProblem problem = new SeatingProblem(PEOPLE, List.of(3, 1), Map.of("A", "B"));

        assertThatCode(problem::validate).doesNotThrowAnyException();
    }

    @Test
    void validate_acceptsPreferencesForUnknownPeople() {
        SeatingProblem problem = new SeatingProblem(
                List.of(new Person("A", "Ghost", "Ghost"), new Person("B")), List.of(2));

        assertThatCode(problem::validate).doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsTooFewSeats() {
        SeatingProblem problem = new SeatingProblem(PEOPLE, List.of(2, 1));

        assertThatThrownBy(problem::validate)
                .isInstanceOf(ProblemValidationException.class)
                .hasMessage("Table capacities add up to 3 seats but 4 people must be seated");
    }

    @Test
    void validate_rejectsCapacitiesWhoseSumExceedsIntRange() {
        SeatingProblem problem = new SeatingProblem(List.of(new Person("A")),
                List.of(Integer.MAX_VALUE, Integer.MAX_VALUE, 3));

        assertThatThrownBy(problem::validate)
                .isInstanceOf(ProblemValidationException.class)
                .hasMessage("Table capacities add up to 4294967297 seats but 1 people must be seated");
    }

    @Test
    void validate_rejectsNonPositiveCapacity() {
        SeatingProblem problem = new SeatingProblem(PEOPLE, List.of(4, 0));

        assertThatThrownBy(problem::validate)
                .isInstanceOf(ProblemValidationException.class)
                .hasMessageContaining("Table 1 has invalid capacity 0");
    }

    @Test
    void validate_rejectsEmptyTableList() {
        SeatingProblem problem = new SeatingProblem(List.of(), List.of());

        assertThatThrownBy(problem::validate)
                .isInstanceOf(ProblemValidationException.class)
                .hasMessageContaining("no tables");
    }

    @Test
    void validate_rejectsDuplicateNames() {
        SeatingProblem problem = new SeatingProblem(List.of(new Person("A"), new Person("A")), List.of(2));

        assertThatThrownBy(problem::validate)
                .isInstanceOf(ProblemValidationException.class)
                .hasMessageContaining("Duplicate person name: 'A'");
    }

    @Test
    void validate_rejectsCompanionOfUnknownPerson() {
        SeatingProblem problem = new SeatingProblem(PEOPLE, List.of(2, 2), Map.of("A", "Z"));

        assertThatThrownBy(problem::validate)
                .isInstanceOf(ProblemValidationException.class)
                .hasMessageContaining("'Z'");
    }
}
