package org.Aayush.dvrp.routing.colony;

import org.Aayush.dvrp.routing.point.PointTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One constructed tour.
 *
 * @param positions positions starting and ending at the origin, with interior origin returns
 *                  marking route boundaries.
 * @param length total travelled distance including the first and last origin edges.
 */
public record Tour(int[] positions, double length) {

    public Tour {
        positions = positions.clone();
    }

    /**
     * @return copy of the visiting order.
     */
    @Override
    public int[] positions() {
        return positions.clone();
    }

    /**
     * Maps positions back to point identifiers.
     */
    public List<String> toPointIds(PointTable points) {
        List<String> ids = new ArrayList<>(positions.length);
        for (int position : positions) {
            ids.add(points.idAt(position));
        }
        return ids;
    }

    /**
     * @return number of origin occurrences strictly inside the tour.
     */
    public int interiorOriginReturns(int originPosition) {
        int returns = 0;
        for (int i = 1; i < positions.length - 1; i++) {
            if (positions[i] == originPosition) {
                returns++;
            }
        }
        return returns;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Tour tour)) {
            return false;
        }
        return Double.compare(length, tour.length) == 0 && Arrays.equals(positions, tour.positions);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(positions) + Double.hashCode(length);
    }

    @Override
    public String toString() {
        return "Tour[positions=" + Arrays.toString(positions) + ", length=" + length + "]";
    }
}
