package org.Aayush.dvrp.routing.point;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only attribute lookup for points, keyed by identifier.
 */
@FunctionalInterface
public interface PointCatalog {

    /**
     * Looks up attributes of one point.
     *
     * @param pointId point identifier.
     * @return point attributes, or empty when the catalog does not know the id.
     */
    Optional<DeliveryPoint> find(String pointId);

    /**
     * Creates an immutable in-memory catalog.
     *
     * @param points points with distinct identifiers.
     */
    static PointCatalog of(Collection<DeliveryPoint> points) {
        return new InMemoryPointCatalog(points);
    }
}
