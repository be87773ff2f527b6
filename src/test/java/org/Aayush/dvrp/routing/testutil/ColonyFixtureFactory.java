package org.Aayush.dvrp.routing.testutil;

import org.Aayush.dvrp.routing.distance.DistanceMatrix;
import org.Aayush.dvrp.routing.distance.PairwiseDistanceTable;
import org.Aayush.dvrp.routing.point.DeliveryPoint;
import org.Aayush.dvrp.routing.point.PointCatalog;
import org.Aayush.dvrp.routing.point.PointTable;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Shared test fixture factory for colony and solver tests.
 */
public final class ColonyFixtureFactory {
    public static final String ORIGIN_ID = "DC";

    private ColonyFixtureFactory() {
    }

    public record Fixture(
            List<DeliveryPoint> points,
            List<String> storeIds,
            PointCatalog catalog,
            PairwiseDistanceTable distances,
            PointTable pointTable,
            DistanceMatrix matrix
    ) {
    }

    /**
     * Origin plus {@code storeCount} stores with identical demand and every distance equal.
     */
    public static Fixture uniform(int storeCount, double pallets, double weight, double distance) {
        List<DeliveryPoint> points = new ArrayList<>();
        points.add(DeliveryPoint.waypoint(ORIGIN_ID));
        for (int i = 1; i <= storeCount; i++) {
            points.add(new DeliveryPoint(storeId(i), pallets, weight));
        }
        PairwiseDistanceTable.Builder distances = PairwiseDistanceTable.builder();
        for (DeliveryPoint a : points) {
            for (DeliveryPoint b : points) {
                distances.put(a.getId(), b.getId(), a.getId().equals(b.getId()) ? 0.0d : distance);
            }
        }
        return assemble(points, distances.build());
    }

    /**
     * Origin at (0, 0) plus stores at seeded random coordinates with seeded random demand.
     */
    public static Fixture random(int storeCount, double maxPallets, double maxWeight, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        List<DeliveryPoint> points = new ArrayList<>();
        double[][] coordinates = new double[storeCount + 1][];
        points.add(DeliveryPoint.waypoint(ORIGIN_ID));
        coordinates[0] = new double[]{0.0d, 0.0d};
        for (int i = 1; i <= storeCount; i++) {
            coordinates[i] = new double[]{random.nextDouble(-10_000.0d, 10_000.0d), random.nextDouble(-10_000.0d, 10_000.0d)};
            points.add(new DeliveryPoint(
                    storeId(i),
                    1.0d + random.nextInt((int) maxPallets),
                    random.nextDouble(1.0d, maxWeight)
            ));
        }
        PairwiseDistanceTable.Builder distances = PairwiseDistanceTable.builder();
        for (int a = 0; a < points.size(); a++) {
            for (int b = 0; b < points.size(); b++) {
                distances.put(points.get(a).getId(), points.get(b).getId(),
                        Math.hypot(coordinates[a][0] - coordinates[b][0], coordinates[a][1] - coordinates[b][1]));
            }
        }
        return assemble(points, distances.build());
    }

    public static String storeId(int index) {
        return "S" + index;
    }

    private static Fixture assemble(List<DeliveryPoint> points, PairwiseDistanceTable distances) {
        List<String> storeIds = new ArrayList<>();
        for (DeliveryPoint point : points) {
            if (!point.getId().equals(ORIGIN_ID)) {
                storeIds.add(point.getId());
            }
        }
        PointCatalog catalog = PointCatalog.of(points);
        PointTable table = PointTable.bind(storeIds, ORIGIN_ID, catalog);
        return new Fixture(points, storeIds, catalog, distances, table, distances.bind(table));
    }
}
