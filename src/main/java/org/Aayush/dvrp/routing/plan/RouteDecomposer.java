package org.Aayush.dvrp.routing.plan;

import org.Aayush.dvrp.routing.colony.Tour;
import org.Aayush.dvrp.routing.distance.DistanceMatrix;
import org.Aayush.dvrp.routing.point.PointTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits a tour into routes at its origin occurrences.
 * <p>
 * Record numbering:
 * </p>
 * <ul>
 * <li>A trailing origin is dropped first.</li>
 * <li>Every origin occurrence opens the next route number and resets the stop sequence to 1.</li>
 * <li>Every other id becomes one {@link RouteRecord}; the sequence advances after each record.</li>
 * <li>The origin itself is never emitted.</li>
 * </ul>
 */
public final class RouteDecomposer {
    public static final String DEFAULT_ROUTE_NAME_PREFIX = "Tractor";

    private final String routeNamePrefix;

    public RouteDecomposer() {
        this(DEFAULT_ROUTE_NAME_PREFIX);
    }

    public RouteDecomposer(String routeNamePrefix) {
        this.routeNamePrefix = routeNamePrefix == null || routeNamePrefix.isBlank()
                ? DEFAULT_ROUTE_NAME_PREFIX
                : routeNamePrefix;
    }

    /**
     * Emits the route records of one identifier path.
     *
     * @param solutionId solution the records belong to.
     * @param pathIds tour as point identifiers, normally starting and ending at the origin.
     * @param originId origin identifier.
     * @return records in path order.
     */
    public List<RouteRecord> decompose(String solutionId, List<String> pathIds, String originId) {
        Objects.requireNonNull(pathIds, "pathIds");
        Objects.requireNonNull(originId, "originId");
        List<String> path = new ArrayList<>(pathIds);
        if (!path.isEmpty() && originId.equals(path.get(path.size() - 1))) {
            path.remove(path.size() - 1);
        }

        List<RouteRecord> records = new ArrayList<>(path.size());
        int routeNumber = 0;
        int sequence = 0;
        for (String pointId : path) {
            if (originId.equals(pointId)) {
                routeNumber++;
                sequence = 1;
                continue;
            }
            records.add(RouteRecord.builder()
                    .solutionId(solutionId)
                    .routeNumber(routeNumber)
                    .routeName(routeName(routeNumber))
                    .pointId(pointId)
                    .sequence(sequence)
                    .build());
            sequence++;
        }
        return List.copyOf(records);
    }

    /**
     * Decomposes a constructed tour and summarizes each route.
     *
     * @param solutionId solution identifier.
     * @param tour best tour.
     * @param distances distance matrix bound to the tour's point table.
     * @return plan with records, routes and origin record.
     */
    public RoutePlan plan(String solutionId, Tour tour, DistanceMatrix distances) {
        Objects.requireNonNull(tour, "tour");
        PointTable points = distances.points();
        String originId = points.originId();
        List<RouteRecord> records = decompose(solutionId, tour.toPointIds(points), originId);

        Map<Integer, List<RouteRecord>> byRoute = new LinkedHashMap<>();
        for (RouteRecord record : records) {
            byRoute.computeIfAbsent(record.getRouteNumber(), number -> new ArrayList<>()).add(record);
        }

        List<Route> routes = new ArrayList<>(byRoute.size());
        for (List<RouteRecord> routeRecords : byRoute.values()) {
            routes.add(summarize(routeRecords, points, distances));
        }
        return new RoutePlan(solutionId, new OriginRecord(solutionId, originId), records, routes, tour.length());
    }

    /**
     * @return display name of one route number.
     */
    public String routeName(int routeNumber) {
        return routeNamePrefix + "_" + routeNumber;
    }

    private static Route summarize(List<RouteRecord> routeRecords, PointTable points, DistanceMatrix distances) {
        RouteRecord first = routeRecords.get(0);
        Route.RouteBuilder builder = Route.builder()
                .routeNumber(first.getRouteNumber())
                .routeName(first.getRouteName());

        double pallets = 0.0d;
        double weight = 0.0d;
        double distance = 0.0d;
        int previous = points.originPosition();
        for (RouteRecord record : routeRecords) {
            int position = points.positionOf(record.getPointId());
            pallets += points.pallets(position);
            weight += points.weight(position);
            distance += distances.get(previous, position);
            previous = position;
            builder.stop(record.getPointId());
        }
        distance += distances.get(previous, points.originPosition());

        return builder
                .pallets(pallets)
                .weight(weight)
                .distance(distance)
                .build();
    }
}
