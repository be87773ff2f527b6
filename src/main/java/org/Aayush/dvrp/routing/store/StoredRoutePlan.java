package org.Aayush.dvrp.routing.store;

import lombok.Value;
import org.Aayush.dvrp.routing.plan.OriginRecord;
import org.Aayush.dvrp.routing.plan.RoutePlan;
import org.Aayush.dvrp.routing.plan.RouteRecord;

import java.util.List;
import java.util.Objects;

/**
 * Unit of persistence: every route record of one solution plus its origin record.
 */
@Value
public class StoredRoutePlan {
    OriginRecord origin;
    List<RouteRecord> records;

    public StoredRoutePlan(OriginRecord origin, List<RouteRecord> records) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.records = List.copyOf(records);
        for (RouteRecord record : this.records) {
            if (!origin.getSolutionId().equals(record.getSolutionId())) {
                throw new IllegalArgumentException(
                        "record of solution " + record.getSolutionId() + " in plan " + origin.getSolutionId());
            }
        }
    }

    /**
     * Extracts the persisted part of a decomposed plan.
     */
    public static StoredRoutePlan of(RoutePlan plan) {
        return new StoredRoutePlan(plan.getOrigin(), plan.getRecords());
    }

    public String solutionId() {
        return origin.getSolutionId();
    }
}
