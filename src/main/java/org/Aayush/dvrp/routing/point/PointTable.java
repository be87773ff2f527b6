package org.Aayush.dvrp.routing.point;

import org.Aayush.dvrp.core.error.ConfigurationException;
import org.Aayush.dvrp.core.id.PositionIndex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Dense positional view of the points taking part in one solve.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Positions follow request order; the origin is appended when the request omits it.</li>
 * <li>Every requested id must be known to the catalog; an origin unknown to the catalog
 * is treated as a zero-demand waypoint.</li>
 * <li>Demands are stored in primitive arrays for allocation-free reads on the search hot path.</li>
 * <li>Immutable after construction; safe for concurrent readers.</li>
 * </ul>
 */
public final class PointTable {
    public static final String REASON_ORIGIN_REQUIRED = "CFG_ORIGIN_REQUIRED";
    public static final String REASON_POINT_LIST_REQUIRED = "CFG_POINT_LIST_REQUIRED";
    public static final String REASON_DUPLICATE_POINT = "CFG_DUPLICATE_POINT";
    public static final String REASON_UNKNOWN_POINT = "CFG_UNKNOWN_POINT";
    public static final String REASON_NO_DELIVERY_POINTS = "CFG_NO_DELIVERY_POINTS";

    private final PositionIndex index;
    private final double[] pallets;
    private final double[] weights;
    private final int originPosition;

    private PointTable(PositionIndex index, double[] pallets, double[] weights, int originPosition) {
        this.index = index;
        this.pallets = pallets;
        this.weights = weights;
        this.originPosition = originPosition;
    }

    /**
     * Joins requested identifiers with catalog attributes.
     *
     * @param requestedIds ordered point ids to solve for, with or without the origin.
     * @param originId origin identifier.
     * @param catalog attribute lookup.
     * @return bound point table.
     * @throws ConfigurationException on blank/duplicate/unknown ids or when nothing is left to deliver.
     */
    public static PointTable bind(List<String> requestedIds, String originId, PointCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        if (originId == null || originId.isBlank()) {
            throw new ConfigurationException(REASON_ORIGIN_REQUIRED, "origin id must be non-blank");
        }
        if (requestedIds == null) {
            throw new ConfigurationException(REASON_POINT_LIST_REQUIRED, "requested point list must be provided");
        }

        List<DeliveryPoint> points = new ArrayList<>(requestedIds.size() + 1);
        Set<String> seen = new HashSet<>(requestedIds.size() * 2);
        for (String pointId : requestedIds) {
            if (pointId == null || pointId.isBlank()) {
                throw new ConfigurationException(DeliveryPoint.REASON_POINT_ID_REQUIRED, "requested point id must be non-blank");
            }
            if (!seen.add(pointId)) {
                throw new ConfigurationException(REASON_DUPLICATE_POINT, "point requested more than once: " + pointId);
            }
            if (pointId.equals(originId)) {
                points.add(resolveOrigin(originId, catalog));
                continue;
            }
            Optional<DeliveryPoint> point = catalog.find(pointId);
            if (point.isEmpty()) {
                throw new ConfigurationException(REASON_UNKNOWN_POINT, "no attributes known for point " + pointId);
            }
            points.add(point.get());
        }
        if (!seen.contains(originId)) {
            points.add(resolveOrigin(originId, catalog));
        }
        if (points.size() < 2) {
            throw new ConfigurationException(REASON_NO_DELIVERY_POINTS, "request contains no point besides the origin");
        }
        return fromPoints(points, originId);
    }

    /**
     * Builds a table directly from points in position order.
     *
     * @param points ordered points, one of which must be the origin.
     * @param originId origin identifier.
     */
    public static PointTable fromPoints(List<DeliveryPoint> points, String originId) {
        Objects.requireNonNull(points, "points");
        List<String> ids = new ArrayList<>(points.size());
        double[] pallets = new double[points.size()];
        double[] weights = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            DeliveryPoint point = points.get(i);
            ids.add(point.getId());
            pallets[i] = point.getPallets();
            weights[i] = point.getWeight();
        }
        PositionIndex index;
        try {
            index = PositionIndex.ofOrdered(ids);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(REASON_DUPLICATE_POINT, ex.getMessage(), ex);
        }
        if (!index.containsId(originId)) {
            throw new ConfigurationException(REASON_ORIGIN_REQUIRED, "origin " + originId + " is not part of the point list");
        }
        return new PointTable(index, pallets, weights, index.positionOf(originId));
    }

    /**
     * Verifies that every non-origin point fits an empty vehicle.
     *
     * @param palletLimit pallet capacity per route.
     * @param weightLimit weight capacity per route.
     * @throws InfeasiblePointException for the first point exceeding a limit.
     */
    public void checkFeasible(double palletLimit, double weightLimit) {
        for (int position = 0; position < size(); position++) {
            if (isOrigin(position)) {
                continue;
            }
            if (pallets[position] > palletLimit) {
                throw new InfeasiblePointException(
                        InfeasiblePointException.REASON_PALLETS_EXCEED_LIMIT,
                        index.idAt(position), pallets[position], palletLimit
                );
            }
            if (weights[position] > weightLimit) {
                throw new InfeasiblePointException(
                        InfeasiblePointException.REASON_WEIGHT_EXCEEDS_LIMIT,
                        index.idAt(position), weights[position], weightLimit
                );
            }
        }
    }

    /**
     * @return number of positions, origin included.
     */
    public int size() {
        return pallets.length;
    }

    /**
     * @return number of non-origin positions.
     */
    public int deliveryCount() {
        return pallets.length - 1;
    }

    public int originPosition() {
        return originPosition;
    }

    public String originId() {
        return index.idAt(originPosition);
    }

    public boolean isOrigin(int position) {
        return position == originPosition;
    }

    public double pallets(int position) {
        return pallets[position];
    }

    public double weight(int position) {
        return weights[position];
    }

    public String idAt(int position) {
        return index.idAt(position);
    }

    public int positionOf(String pointId) {
        return index.positionOf(pointId);
    }

    public boolean contains(String pointId) {
        return index.containsId(pointId);
    }

    private static DeliveryPoint resolveOrigin(String originId, PointCatalog catalog) {
        return catalog.find(originId).orElseGet(() -> DeliveryPoint.waypoint(originId));
    }
}
