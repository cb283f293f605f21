package org.seatplan.problem;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The read-only input of an annealing run: the guests, the table capacities and the declared
 * companion pairs. Instances are never mutated after construction, so they can be shared by all
 * chains of the replica ladder.
 */
public final class SeatingProblem {

    private final List<Person> people;
    private final List<Integer> tableCapacities;
    private final Map<String, String> companions;

    /**
     * @param people          guests in input order
     * @param tableCapacities capacities in table order
     * @param companions      companion pairs as {@code personOne -> personTwo}; may be empty
     */
    public SeatingProblem(List<Person> people, List<Integer> tableCapacities, Map<String, String> companions) {
        this.people = List.copyOf(Objects.requireNonNull(people, "people"));
        this.tableCapacities = List.copyOf(Objects.requireNonNull(tableCapacities, "tableCapacities"));
        this.companions = companions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(companions));
    }

    public SeatingProblem(List<Person> people, List<Integer> tableCapacities) {
        this(people, tableCapacities, Map.of());
    }

    public List<Person> getPeople() {
        return people;
    }

    public List<Integer> getTableCapacities() {
        return tableCapacities;
    }

    public Map<String, String> getCompanions() {
        return companions;
    }

    public int getPeopleCount() {
        return people.size();
    }

    public long getTotalSeats() {
        long seats = 0;
        for (int capacity : tableCapacities) {
            seats += capacity;
        }
        return seats;
    }

    public int getPreferenceCount() {
        int count = 0;
        for (Person person : people) {
            count += person.preferences().size();
        }
        return count;
    }

    /**
     * Checks the problem for inconsistencies that would make an assignment impossible or
     * meaningless.
     *
     * @throws ProblemValidationException describing the first inconsistency found
     */
    public void validate() throws ProblemValidationException {
        if (tableCapacities.isEmpty()) {
            throw new ProblemValidationException("Problem declares no tables");
        }
        for (int i = 0; i < tableCapacities.size(); i++) {
            Integer capacity = tableCapacities.get(i);
            if (capacity == null || capacity <= 0) {
                throw new ProblemValidationException(
                        String.format("Table %d has invalid capacity %s; capacities must be positive", i, capacity));
            }
        }

        Set<String> names = new HashSet<>();
        for (Person person : people) {
            if (person.name().isBlank()) {
                throw new ProblemValidationException("Person names must not be blank");
            }
            if (!names.add(person.name())) {
                throw new ProblemValidationException("Duplicate person name: '" + person.name() + "'");
            }
        }

        long seats = getTotalSeats();
        if (seats != people.size()) {
            throw new ProblemValidationException(String.format(
                    "Table capacities add up to %d seats but %d people must be seated", seats, people.size()));
        }

        for (Map.Entry<String, String> pair : companions.entrySet()) {
            if (!names.contains(pair.getKey())) {
                throw new ProblemValidationException("Companion pair names unknown person '" + pair.getKey() + "'");
            }
            if (!names.contains(pair.getValue())) {
                throw new ProblemValidationException("Companion pair names unknown person '" + pair.getValue() + "'");
            }
        }
    }
}
