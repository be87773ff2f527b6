package org.Aayush.dvrp.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between opaque point identifiers and dense integer positions.
 *
 * <p>Positions are assigned once, in input order, and are the index space of every
 * positional structure used during search (demand arrays, distance matrix, pheromone trail).</p>
 */
public interface PositionIndex {

    /**
     * Converts a point identifier to its position.
     * @param pointId client-facing point identifier.
     * @return position in range [0, size).
     * @throws UnknownPointIdException If the identifier is not indexed.
     */
    int positionOf(String pointId) throws UnknownPointIdException;

    /**
     * Converts a position back to its point identifier.
     * @param position dense position.
     * @return point identifier.
     * @throws IndexOutOfBoundsException If the position is invalid.
     */
    String idAt(int position);

    /**
     * Checks whether a point identifier is indexed.
     *
     * @param pointId identifier to test.
     * @return true when the identifier has a position.
     */
    boolean containsId(String pointId);

    /**
     * Returns number of indexed points.
     *
     * @return index size.
     */
    int size();

    /**
     * Exception thrown when a point identifier has no position.
     */
    @StandardException
    class UnknownPointIdException extends RuntimeException {
    }

    /**
     * Creates an immutable index assigning positions in list order.
     *
     * @param orderedIds distinct, non-null identifiers.
     * @return immutable index.
     * @throws IllegalArgumentException on null or duplicate identifiers.
     */
    static PositionIndex ofOrdered(List<String> orderedIds) {
        return new FastUtilPositionIndex(orderedIds);
    }
}
