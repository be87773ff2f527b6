package org.Aayush.dvrp.routing.point;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when one point's demand alone exceeds a vehicle limit.
 *
 * <p>No route can carry such a point, so the condition is reported before construction.</p>
 */
@Getter
@Accessors(fluent = true)
public final class InfeasiblePointException extends RuntimeException {
    public static final String REASON_PALLETS_EXCEED_LIMIT = "FEAS_PALLETS_EXCEED_LIMIT";
    public static final String REASON_WEIGHT_EXCEEDS_LIMIT = "FEAS_WEIGHT_EXCEEDS_LIMIT";

    private final String reasonCode;
    private final String pointId;
    private final double demand;
    private final double limit;

    InfeasiblePointException(String reasonCode, String pointId, double demand, double limit) {
        super("[" + reasonCode + "] point " + pointId + " demand " + demand + " exceeds limit " + limit);
        this.reasonCode = reasonCode;
        this.pointId = pointId;
        this.demand = demand;
        this.limit = limit;
    }
}
