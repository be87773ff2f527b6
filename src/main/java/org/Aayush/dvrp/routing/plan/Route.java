package org.Aayush.dvrp.routing.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One vehicle route of a plan with its load summary.
 */
@Value
@Builder
public class Route {
    int routeNumber;
    String routeName;
    /** Stops in driving order, origin excluded. */
    @Singular("stop")
    List<String> stops;
    /** Sum of pallet demand over the stops. */
    double pallets;
    /** Sum of weight demand over the stops. */
    double weight;
    /** Distance origin -> stops -> origin. */
    double distance;

    public int stopCount() {
        return stops.size();
    }
}
