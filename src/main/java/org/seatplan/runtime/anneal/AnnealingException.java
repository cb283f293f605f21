package org.seatplan.runtime.anneal;

/**
 * Thrown when an annealing run cannot be completed, for example because a chain task failed or
 * the coordinating thread was interrupted. A run is never partially recovered.
 */
public class AnnealingException extends RuntimeException {

    public AnnealingException(String message, Throwable cause) {
        super(message, cause);
    }
}
