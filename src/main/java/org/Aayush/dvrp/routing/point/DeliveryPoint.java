package org.Aayush.dvrp.routing.point;

import lombok.Builder;
import lombok.Value;
import org.Aayush.dvrp.core.error.ConfigurationException;

/**
 * One point of a delivery problem with its per-visit demand.
 *
 * <p>Demands are expressed in consistent domain units (pallets and pounds in the
 * reference deployment). The origin's demand is never counted against capacity.</p>
 */
@Value
public class DeliveryPoint {
    public static final String REASON_POINT_ID_REQUIRED = "CFG_POINT_ID_REQUIRED";
    public static final String REASON_DEMAND_INVALID = "CFG_POINT_DEMAND_INVALID";

    /** Opaque point identifier. */
    String id;
    /** Pallet demand, non-negative. */
    double pallets;
    /** Weight demand, non-negative. */
    double weight;

    /**
     * Creates a validated point.
     *
     * @param id non-blank identifier.
     * @param pallets finite non-negative pallet demand.
     * @param weight finite non-negative weight demand.
     * @throws ConfigurationException when the id is blank or a demand is negative/non-finite.
     */
    @Builder
    public DeliveryPoint(String id, double pallets, double weight) {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException(REASON_POINT_ID_REQUIRED, "point id must be non-blank");
        }
        requireDemand(id, "pallets", pallets);
        requireDemand(id, "weight", weight);
        this.id = id;
        this.pallets = pallets;
        this.weight = weight;
    }

    /**
     * Returns a point with the given id and no demand.
     */
    public static DeliveryPoint waypoint(String id) {
        return new DeliveryPoint(id, 0.0d, 0.0d);
    }

    private static void requireDemand(String id, String field, double value) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new ConfigurationException(
                    REASON_DEMAND_INVALID,
                    field + " demand of point " + id + " must be finite and >= 0, got " + value
            );
        }
    }
}
