package org.seatplan.problem;

import java.util.List;

/**
 * Holds a seating problem as it appears in the JSON input file.
 */
public final class ProblemDocument {

    public static final class PersonEntry {
        public String name;
        public List<String> preferences;
    }

    public static final class CompanionEntry {
        public String personOne;
        public String personTwo;
    }

    public List<PersonEntry> people;
    public List<Integer> tables;
    public List<CompanionEntry> plusOnes;
}
