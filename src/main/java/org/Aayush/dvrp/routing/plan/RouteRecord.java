package org.Aayush.dvrp.routing.plan;

import lombok.Builder;
import lombok.Value;

/**
 * One persisted stop of a route plan.
 */
@Value
@Builder
public class RouteRecord {
    /** Solution the stop belongs to. */
    String solutionId;
    /** 1-based route number. */
    int routeNumber;
    /** Display name of the route, for example {@code Tractor_1}. */
    String routeName;
    /** Delivered point. Never the origin. */
    String pointId;
    /** 1-based position of the stop inside its route. */
    int sequence;
}
