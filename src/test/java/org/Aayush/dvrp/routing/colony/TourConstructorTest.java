package org.Aayush.dvrp.routing.colony;

import org.Aayush.dvrp.routing.distance.DistanceMatrix;
import org.Aayush.dvrp.routing.distance.PairwiseDistanceTable;
import org.Aayush.dvrp.routing.distance.UnknownPairException;
import org.Aayush.dvrp.routing.point.DeliveryPoint;
import org.Aayush.dvrp.routing.point.InfeasiblePointException;
import org.Aayush.dvrp.routing.point.PointCatalog;
import org.Aayush.dvrp.routing.point.PointTable;
import org.Aayush.dvrp.routing.testutil.ColonyFixtureFactory;
import org.Aayush.dvrp.routing.testutil.ColonyFixtureFactory.Fixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TourConstructor Tests")
class TourConstructorTest {

    @Test
    @DisplayName("Capacity: four unit-demand points with pallet limit 2 split into two routes")
    void testFourPointScenario() {
        Fixture fixture = ColonyFixtureFactory.uniform(4, 1.0d, 10.0d, 1.0d);
        TourConstructor constructor = new TourConstructor(
                fixture.pointTable(), fixture.matrix(), 2.0d, 1_000.0d, 1.0d, 1.0d);

        Tour tour = constructor.construct(new PheromoneTrail(fixture.pointTable().size()), new SplittableRandom(1L));

        int origin = fixture.pointTable().originPosition();
        int[] positions = tour.positions();
        assertEquals(7, positions.length);
        assertEquals(origin, positions[0]);
        assertEquals(origin, positions[3]);
        assertEquals(origin, positions[6]);
        assertEquals(1, tour.interiorOriginReturns(origin));
        assertEquals(6.0d, tour.length(), 1e-12);
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1L, 7L, 42L, 1_337L, 99_991L})
    @DisplayName("Structure: tours cover every point once and respect capacity per route")
    void testTourStructure(long seed) {
        Fixture fixture = ColonyFixtureFactory.random(25, 6.0d, 900.0d, seed);
        PointTable points = fixture.pointTable();
        DistanceMatrix matrix = fixture.matrix();
        double palletLimit = 10.0d;
        double weightLimit = 2_000.0d;
        TourConstructor constructor = new TourConstructor(points, matrix, palletLimit, weightLimit, 1.0d, 2.0d);

        Tour tour = constructor.construct(new PheromoneTrail(points.size()), new SplittableRandom(seed));

        int origin = points.originPosition();
        int[] positions = tour.positions();
        assertEquals(origin, positions[0]);
        assertEquals(origin, positions[positions.length - 1]);

        int[] visits = new int[points.size()];
        double pallets = 0.0d;
        double weight = 0.0d;
        double length = 0.0d;
        for (int i = 0; i < positions.length; i++) {
            if (i > 0) {
                length += matrix.get(positions[i - 1], positions[i]);
            }
            if (positions[i] == origin) {
                pallets = 0.0d;
                weight = 0.0d;
                continue;
            }
            visits[positions[i]]++;
            pallets += points.pallets(positions[i]);
            weight += points.weight(positions[i]);
            assertTrue(pallets <= palletLimit, "pallet limit exceeded");
            assertTrue(weight <= weightLimit, "weight limit exceeded");
        }
        for (int position = 0; position < points.size(); position++) {
            assertEquals(position == origin ? 0 : 1, visits[position], "visits of " + points.idAt(position));
        }
        assertEquals(length, tour.length(), 1e-6);
    }

    @Test
    @DisplayName("Same random stream builds the same tour")
    void testDeterministicForSameStream() {
        Fixture fixture = ColonyFixtureFactory.random(15, 4.0d, 500.0d, 3L);
        TourConstructor constructor = new TourConstructor(
                fixture.pointTable(), fixture.matrix(), 8.0d, 1_500.0d, 1.0d, 1.0d);
        PheromoneTrail trail = new PheromoneTrail(fixture.pointTable().size());

        Tour first = constructor.construct(trail, new SplittableRandom(11L));
        Tour second = constructor.construct(trail, new SplittableRandom(11L));

        assertArrayEquals(first.positions(), second.positions());
        assertEquals(first.length(), second.length());
    }

    @Test
    @DisplayName("Edge Case: all-zero pheromone falls back to uniform choice")
    void testZeroPheromoneFallback() {
        Fixture fixture = ColonyFixtureFactory.uniform(6, 1.0d, 1.0d, 5.0d);
        TourConstructor constructor = new TourConstructor(
                fixture.pointTable(), fixture.matrix(), 100.0d, 100.0d, 1.0d, 1.0d);

        Tour tour = constructor.construct(new PheromoneTrail(fixture.pointTable().size(), 0.0d), new SplittableRandom(5L));

        assertEquals(8, tour.positions().length);
        assertEquals(0, tour.interiorOriginReturns(fixture.pointTable().originPosition()));
        assertEquals(35.0d, tour.length(), 1e-12);
    }

    @Test
    @DisplayName("Edge Case: zero-distance candidate is taken next")
    void testZeroDistancePreferred() {
        List<DeliveryPoint> all = List.of(
                DeliveryPoint.waypoint("DC"),
                new DeliveryPoint("A", 1.0d, 1.0d),
                new DeliveryPoint("B", 1.0d, 1.0d),
                new DeliveryPoint("C", 1.0d, 1.0d)
        );
        PairwiseDistanceTable.Builder builder = PairwiseDistanceTable.builder();
        for (DeliveryPoint from : all) {
            for (DeliveryPoint to : all) {
                builder.put(from.getId(), to.getId(), to.getId().equals("C") ? 0.0d : 3.0d);
            }
        }
        PointTable points = PointTable.bind(List.of("A", "B", "C"), "DC", PointCatalog.of(all));
        DistanceMatrix matrix = builder.build().bind(points);
        TourConstructor constructor = new TourConstructor(points, matrix, 10.0d, 10.0d, 1.0d, 1.0d);
        int c = points.positionOf("C");

        for (long seed = 0L; seed < 20L; seed++) {
            int[] positions = constructor.construct(new PheromoneTrail(points.size()), new SplittableRandom(seed)).positions();
            assertTrue(positions[1] == c || positions[2] == c, "C should be visited first or second");
        }
    }

    @Test
    @DisplayName("Exception Path: point larger than an empty vehicle is rejected up front")
    void testInfeasiblePoint() {
        Fixture fixture = ColonyFixtureFactory.uniform(3, 5.0d, 1.0d, 1.0d);

        InfeasiblePointException ex = assertThrows(
                InfeasiblePointException.class,
                () -> new TourConstructor(fixture.pointTable(), fixture.matrix(), 4.0d, 100.0d, 1.0d, 1.0d)
        );
        assertEquals(InfeasiblePointException.REASON_PALLETS_EXCEED_LIMIT, ex.reasonCode());
    }

    @Test
    @DisplayName("Exception Path: missing distance surfaces as UnknownPairException")
    void testMissingDistance() {
        List<DeliveryPoint> all = List.of(
                DeliveryPoint.waypoint("DC"),
                new DeliveryPoint("A", 1.0d, 1.0d)
        );
        PointTable points = PointTable.bind(List.of("A"), "DC", PointCatalog.of(all));
        DistanceMatrix matrix = PairwiseDistanceTable.builder().put("DC", "A", 4.0d).build().bind(points);
        TourConstructor constructor = new TourConstructor(points, matrix, 10.0d, 10.0d, 1.0d, 1.0d);

        UnknownPairException ex = assertThrows(
                UnknownPairException.class,
                () -> constructor.construct(new PheromoneTrail(points.size()), new SplittableRandom(1L))
        );
        assertEquals("A", ex.fromPointId());
        assertEquals("DC", ex.toPointId());
    }
}
