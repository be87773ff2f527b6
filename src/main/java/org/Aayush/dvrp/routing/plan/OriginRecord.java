package org.Aayush.dvrp.routing.plan;

import lombok.Value;

/**
 * Persisted origin of a route plan.
 */
@Value
public class OriginRecord {
    String solutionId;
    String originId;
}
