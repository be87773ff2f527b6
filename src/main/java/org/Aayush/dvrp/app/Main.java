package org.Aayush.dvrp.app;

import org.Aayush.dvrp.routing.colony.ColonyParameters;
import org.Aayush.dvrp.routing.core.RouteSolver;
import org.Aayush.dvrp.routing.core.SolveRequest;
import org.Aayush.dvrp.routing.core.SolveResponse;
import org.Aayush.dvrp.routing.distance.PairwiseDistanceTable;
import org.Aayush.dvrp.routing.plan.Route;
import org.Aayush.dvrp.routing.point.DeliveryPoint;
import org.Aayush.dvrp.routing.point.PointCatalog;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Demo entry point solving a synthetic ring of stores around one distribution center.
 */
public class Main {
    static final String SOLUTION_ID = "demo";
    static final String ORIGIN_ID = "DC";
    static final int STORE_COUNT = 12;
    static final double PALLET_LIMIT = 26.0d;
    static final double WEIGHT_LIMIT = 40_000.0d;

    /**
     * Solves the demo instance and prints its route table.
     *
     * @param args optional seed as first argument.
     */
    public static void main(String[] args) {
        long seed = args.length > 0 ? Long.parseLong(args[0]) : 7L;
        PrintStream out = System.out;

        List<DeliveryPoint> points = new ArrayList<>();
        double[][] coordinates = new double[STORE_COUNT + 1][];
        points.add(DeliveryPoint.waypoint(ORIGIN_ID));
        coordinates[0] = new double[]{0.0d, 0.0d};
        for (int i = 1; i <= STORE_COUNT; i++) {
            double angle = 2.0d * Math.PI * i / STORE_COUNT;
            double radius = 5_000.0d + 750.0d * (i % 4);
            coordinates[i] = new double[]{radius * Math.cos(angle), radius * Math.sin(angle)};
            points.add(new DeliveryPoint(storeId(i), 4.0d + (i % 5) * 2.0d, 5_000.0d + (i % 3) * 2_500.0d));
        }

        PairwiseDistanceTable.Builder distances = PairwiseDistanceTable.builder();
        for (int a = 0; a < points.size(); a++) {
            for (int b = 0; b < points.size(); b++) {
                distances.put(points.get(a).getId(), points.get(b).getId(),
                        Math.hypot(coordinates[a][0] - coordinates[b][0], coordinates[a][1] - coordinates[b][1]));
            }
        }

        RouteSolver solver = RouteSolver.builder()
                .pointCatalog(PointCatalog.of(points))
                .distanceTable(distances.build())
                .build();

        SolveRequest.SolveRequestBuilder request = SolveRequest.builder()
                .solutionId(SOLUTION_ID)
                .originId(ORIGIN_ID)
                .palletLimit(PALLET_LIMIT)
                .weightLimit(WEIGHT_LIMIT)
                .parameters(ColonyParameters.defaults())
                .seed(seed);
        for (int i = 1; i <= STORE_COUNT; i++) {
            request.pointId(storeId(i));
        }

        SolveResponse response = solver.solve(request.build());
        out.println(response.getMessage());
        out.printf(Locale.US, "Total distance: %.2f meters%n", response.getTotalLength());
        out.printf(Locale.US, "%-12s %6s %8s %10s %12s  %s%n", "Tractor", "Stores", "Pallets", "Weight", "Distance", "Route");
        for (Route route : response.getPlan().getRoutes()) {
            out.printf(Locale.US, "%-12s %6d %8.1f %10.0f %12.2f  %s%n",
                    route.getRouteName(),
                    route.stopCount(),
                    route.getPallets(),
                    route.getWeight(),
                    route.getDistance(),
                    String.join(" -> ", route.getStops()));
        }

        SolveResponse repeated = solver.solve(request.build());
        out.println(repeated.getMessage());
    }

    private static String storeId(int index) {
        return String.format(Locale.US, "S%02d", index);
    }
}
