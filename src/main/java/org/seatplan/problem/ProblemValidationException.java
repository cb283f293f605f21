package org.seatplan.problem;

/**
 * Thrown when a seating problem cannot be loaded or is internally inconsistent, for example when
 * the table capacities do not add up to the number of guests. Raised before any annealing work
 * starts; there is no recovery from it.
 */
public class ProblemValidationException extends Exception {

    /**
     * Constructs a new validation exception with the specified detail message.
     * @param message The detail message.
     */
    public ProblemValidationException(String message) {
        super(message);
    }

    /**
     * Constructs a new validation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ProblemValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
