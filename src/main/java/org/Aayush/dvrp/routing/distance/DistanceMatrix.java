package org.Aayush.dvrp.routing.distance;

import org.Aayush.dvrp.routing.point.PointTable;

/**
 * Dense distance matrix over the positions of one {@link PointTable}.
 * <p>
 * Undefined pairs are stored as {@code NaN} and raise {@link UnknownPairException}
 * when read. Immutable; safe for concurrent readers.
 * </p>
 */
public final class DistanceMatrix {
    private final PointTable points;
    private final int size;
    private final double[] values;

    DistanceMatrix(PointTable points, double[] values) {
        this.points = points;
        this.size = points.size();
        if (values.length != size * size) {
            throw new IllegalArgumentException("matrix length " + values.length + " does not match " + size + "x" + size);
        }
        this.values = values;
    }

    /**
     * Returns distance between two positions.
     *
     * @throws UnknownPairException when the pair is undefined.
     */
    public double get(int from, int to) {
        double value = values[from * size + to];
        if (Double.isNaN(value)) {
            throw new UnknownPairException(points.idAt(from), points.idAt(to));
        }
        return value;
    }

    /**
     * @return whether the pair has a recorded distance.
     */
    public boolean isDefined(int from, int to) {
        return !Double.isNaN(values[from * size + to]);
    }

    public int size() {
        return size;
    }

    public PointTable points() {
        return points;
    }
}
