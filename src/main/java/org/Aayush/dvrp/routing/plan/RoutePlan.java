package org.Aayush.dvrp.routing.plan;

import lombok.Value;

import java.util.List;

/**
 * Decomposed solution: persisted records plus per-route summaries.
 */
@Value
public class RoutePlan {
    String solutionId;
    OriginRecord origin;
    /** Records in emission order. */
    List<RouteRecord> records;
    /** Non-empty routes ordered by route number. */
    List<Route> routes;
    /** Length of the tour the plan was decomposed from. */
    double totalLength;

    public RoutePlan(String solutionId, OriginRecord origin, List<RouteRecord> records, List<Route> routes,
                     double totalLength) {
        this.solutionId = solutionId;
        this.origin = origin;
        this.records = List.copyOf(records);
        this.routes = List.copyOf(routes);
        this.totalLength = totalLength;
    }

    public int routeCount() {
        return routes.size();
    }
}
