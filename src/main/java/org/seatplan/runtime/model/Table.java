package org.seatplan.runtime.model;

import org.seatplan.problem.Person;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A table with a fixed number of seats, every one of them occupied. The set of occupant names is
 * kept alongside the seat list so membership checks during scoring are constant time.
 * <p>
 * Tables are only mutated by {@link Assignment} while it builds a fresh copy; once an assignment
 * has been handed out its tables are never changed again.
 */
public final class Table {

    private final int capacity;
    private final Person[] seats;
    private final Set<String> names;

    Table(List<Person> occupants) {
        this.capacity = occupants.size();
        this.seats = occupants.toArray(new Person[0]);
        this.names = new HashSet<>(capacity * 2);
        for (Person person : seats) {
            names.add(person.name());
        }
    }

    private Table(Table source) {
        this.capacity = source.capacity;
        this.seats = source.seats.clone();
        this.names = new HashSet<>(source.names);
    }

    Table copy() {
        return new Table(this);
    }

    public int getCapacity() {
        return capacity;
    }

    public Person getOccupant(int seat) {
        return seats[seat];
    }

    public List<Person> getOccupants() {
        return List.of(seats);
    }

    /**
     * @param name a person's name
     * @return whether the named person sits at this table
     */
    public boolean isSeated(String name) {
        return names.contains(name);
    }

    /**
     * Replaces the occupant of a seat and returns the person who sat there.
     */
    Person replace(int seat, Person incoming) {
        Person outgoing = seats[seat];
        seats[seat] = incoming;
        names.remove(outgoing.name());
        names.add(incoming.name());
        return outgoing;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Table[").append(capacity).append("]{");
        for (int i = 0; i < seats.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(seats[i].name());
        }
        return sb.append('}').toString();
    }
}
