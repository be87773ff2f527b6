package org.Aayush.dvrp.routing.point;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable map-backed {@link PointCatalog}; safe for concurrent readers.
 */
public final class InMemoryPointCatalog implements PointCatalog {
    private final Map<String, DeliveryPoint> pointsById;

    public InMemoryPointCatalog(Collection<DeliveryPoint> points) {
        Objects.requireNonNull(points, "points");
        Map<String, DeliveryPoint> byId = new HashMap<>(points.size() * 2);
        for (DeliveryPoint point : points) {
            Objects.requireNonNull(point, "point");
            if (byId.putIfAbsent(point.getId(), point) != null) {
                throw new IllegalArgumentException("duplicate catalog point id: " + point.getId());
            }
        }
        this.pointsById = Map.copyOf(byId);
    }

    @Override
    public Optional<DeliveryPoint> find(String pointId) {
        if (pointId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pointsById.get(pointId));
    }

    /**
     * @return number of points in this catalog.
     */
    public int size() {
        return pointsById.size();
    }
}
