package org.seatplan.runtime.anneal;

import org.seatplan.runtime.model.Assignment;

/**
 * The state carried by one level of the replica ladder between rounds. Ownership passes from the
 * coordinator to exactly one chain task per round and back.
 *
 * @param assignment current assignment of the chain
 * @param score      its objective value
 */
public record ChainState(Assignment assignment, double score) {
}
