package org.seatplan.runtime.model;

import org.seatplan.problem.Person;
import org.seatplan.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A complete partition of the guests across the tables: every person sits at exactly one table
 * and every seat is filled.
 * <p>
 * Assignments are value-like. The only mutation primitive is the seat swap used by
 * {@link #neighbour(int, IRandomProvider)}, and it is applied to a deep copy, so an assignment
 * can be handed between chains without any chance of aliasing.
 */
public final class Assignment {

    private final List<Table> tables;

    private Assignment(List<Table> tables) {
        this.tables = tables;
    }

    /**
     * Seats the given people uniformly at random: the people are shuffled and then poured into
     * the tables in order, each table taking exactly as many as it has seats.
     *
     * @param people          the guests
     * @param tableCapacities seats per table, in table order
     * @param random          source of randomness for the shuffle
     * @return a new random assignment
     * @throws IllegalArgumentException if the capacities do not add up to the number of people
     *                                  or a capacity is not positive
     */
    public static Assignment random(List<Person> people, List<Integer> tableCapacities, IRandomProvider random) {
        long seats = 0;
        for (int capacity : tableCapacities) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Table capacity must be positive but was " + capacity);
            }
            seats += capacity;
        }
        if (seats != people.size()) {
            throw new IllegalArgumentException(String.format(
                    "Cannot seat %d people at tables with %d seats in total", people.size(), seats));
        }

        List<Person> shuffled = new ArrayList<>(people);
        Collections.shuffle(shuffled, random.asJavaRandom());

        List<Table> tables = new ArrayList<>(tableCapacities.size());
        int position = 0;
        for (int capacity : tableCapacities) {
            tables.add(new Table(shuffled.subList(position, position + capacity)));
            position += capacity;
        }
        return new Assignment(tables);
    }

    /**
     * Builds an assignment from explicit seatings, one list of occupants per table. Each table's
     * capacity is the size of its list.
     */
    public static Assignment of(List<List<Person>> seating) {
        List<Table> tables = new ArrayList<>(seating.size());
        for (List<Person> occupants : seating) {
            if (occupants.isEmpty()) {
                throw new IllegalArgumentException("A table needs at least one seat");
            }
            tables.add(new Table(occupants));
        }
        return new Assignment(tables);
    }

    /**
     * @return a deep copy sharing no mutable state with this assignment
     */
    public Assignment copy() {
        List<Table> copies = new ArrayList<>(tables.size());
        for (Table table : tables) {
            copies.add(table.copy());
        }
        return new Assignment(copies);
    }

    /**
     * Produces a neighbouring assignment by performing {@code swapCount} random swaps. Each swap
     * picks two distinct tables, one seat at each, and exchanges their occupants. This assignment
     * is left untouched.
     * <p>
     * With a single table there is nobody to swap with and an unchanged copy is returned.
     *
     * @param swapCount number of independent swaps
     * @param random    source of randomness
     * @return the neighbour
     */
    public Assignment neighbour(int swapCount, IRandomProvider random) {
        Assignment neighbour = copy();
        int tableCount = tables.size();
        if (tableCount < 2) {
            return neighbour;
        }
        for (int i = 0; i < swapCount; i++) {
            int first = random.nextInt(tableCount);
            int second = random.nextInt(tableCount - 1);
            if (second >= first) {
                second++;
            }
            Table tableOne = neighbour.tables.get(first);
            Table tableTwo = neighbour.tables.get(second);
            int seatOne = random.nextInt(tableOne.getCapacity());
            int seatTwo = random.nextInt(tableTwo.getCapacity());

            Person personOne = tableOne.getOccupant(seatOne);
            Person personTwo = tableTwo.replace(seatTwo, personOne);
            tableOne.replace(seatOne, personTwo);
        }
        return neighbour;
    }

    public List<Table> getTables() {
        return Collections.unmodifiableList(tables);
    }

    public int getTableCount() {
        return tables.size();
    }

    public int getPeopleCount() {
        int count = 0;
        for (Table table : tables) {
            count += table.getCapacity();
        }
        return count;
    }

    public int getPreferenceCount() {
        int count = 0;
        for (Table table : tables) {
            for (int seat = 0; seat < table.getCapacity(); seat++) {
                count += table.getOccupant(seat).preferences().size();
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "Assignment" + tables;
    }
}
