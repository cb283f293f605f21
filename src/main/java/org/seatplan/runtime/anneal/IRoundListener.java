package org.seatplan.runtime.anneal;

/**
 * Receives a snapshot after every cooling round. Called on the coordinating thread, between
 * rounds, so implementations never race with chain tasks.
 */
@FunctionalInterface
public interface IRoundListener {

    IRoundListener NONE = snapshot -> { };

    void onRoundCompleted(RoundSnapshot snapshot);
}
