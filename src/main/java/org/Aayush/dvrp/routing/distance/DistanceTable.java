package org.Aayush.dvrp.routing.distance;

import org.Aayush.dvrp.routing.point.PointTable;

import java.util.Objects;

/**
 * Read-only pairwise distance lookup keyed by point identifiers.
 *
 * <p>Implementations must be pure and safe for concurrent readers.</p>
 */
public interface DistanceTable {

    /**
     * Returns the recorded distance for one ordered pair.
     *
     * @param fromPointId origin identifier.
     * @param toPointId destination identifier.
     * @return non-negative distance.
     * @throws UnknownPairException when no entry exists for the pair.
     */
    double distance(String fromPointId, String toPointId);

    /**
     * Checks whether an entry exists for one ordered pair.
     */
    boolean contains(String fromPointId, String toPointId);

    /**
     * Materializes distances between all positions of a point table.
     *
     * <p>Pairs missing from this table stay undefined in the matrix and fail on access.</p>
     *
     * @param points bound point table.
     * @return dense positional matrix.
     */
    default DistanceMatrix bind(PointTable points) {
        Objects.requireNonNull(points, "points");
        int n = points.size();
        double[] values = new double[n * n];
        for (int from = 0; from < n; from++) {
            String fromId = points.idAt(from);
            for (int to = 0; to < n; to++) {
                String toId = points.idAt(to);
                values[from * n + to] = contains(fromId, toId) ? distance(fromId, toId) : Double.NaN;
            }
        }
        return new DistanceMatrix(points, values);
    }
}
