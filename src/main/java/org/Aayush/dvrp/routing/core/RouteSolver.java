package org.Aayush.dvrp.routing.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.dvrp.core.error.ConfigurationException;
import org.Aayush.dvrp.routing.colony.AntColonySearch;
import org.Aayush.dvrp.routing.colony.ColonyListener;
import org.Aayush.dvrp.routing.colony.ColonyParameters;
import org.Aayush.dvrp.routing.colony.ColonyResult;
import org.Aayush.dvrp.routing.distance.DistanceMatrix;
import org.Aayush.dvrp.routing.distance.DistanceTable;
import org.Aayush.dvrp.routing.plan.RouteDecomposer;
import org.Aayush.dvrp.routing.plan.RoutePlan;
import org.Aayush.dvrp.routing.point.PointCatalog;
import org.Aayush.dvrp.routing.point.PointTable;
import org.Aayush.dvrp.routing.store.InMemoryRoutePlanStore;
import org.Aayush.dvrp.routing.store.RoutePlanStore;
import org.Aayush.dvrp.routing.store.StoredRoutePlan;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Main route planning entry point.
 *
 * <p>Execution flow for one request:</p>
 * <ul>
 * <li>Validate the solution id and skip all work when the store already holds it.</li>
 * <li>Validate limits and parameters, join requested ids with the point catalog.</li>
 * <li>Reject points that cannot fit an empty vehicle before any ant runs.</li>
 * <li>Bind distances to positions and run the colony search.</li>
 * <li>Decompose the best tour into route records and store them in one atomic write.</li>
 * </ul>
 * <p>
 * {@link org.Aayush.dvrp.routing.distance.UnknownPairException} and
 * {@link org.Aayush.dvrp.routing.point.InfeasiblePointException} propagate unchanged; nothing is
 * stored when the search fails.
 * </p>
 */
@Slf4j
public final class RouteSolver implements RoutePlanningService {
    public static final String REASON_REQUEST_REQUIRED = "CFG_REQUEST_REQUIRED";
    public static final String REASON_SOLUTION_ID_REQUIRED = "CFG_SOLUTION_ID_REQUIRED";
    public static final String REASON_PALLET_LIMIT_INVALID = "CFG_PALLET_LIMIT_INVALID";
    public static final String REASON_WEIGHT_LIMIT_INVALID = "CFG_WEIGHT_LIMIT_INVALID";

    private final PointCatalog pointCatalog;
    private final DistanceTable distanceTable;
    private final RoutePlanStore planStore;
    private final ColonyListener listener;

    /**
     * Creates the solver facade.
     *
     * @param pointCatalog point attribute lookup.
     * @param distanceTable pairwise distance lookup.
     * @param planStore plan persistence; defaults to a fresh in-memory store.
     * @param listener search observability hooks; defaults to none.
     */
    @Builder
    public RouteSolver(
            PointCatalog pointCatalog,
            DistanceTable distanceTable,
            RoutePlanStore planStore,
            ColonyListener listener
    ) {
        this.pointCatalog = Objects.requireNonNull(pointCatalog, "pointCatalog");
        this.distanceTable = Objects.requireNonNull(distanceTable, "distanceTable");
        this.planStore = planStore == null ? new InMemoryRoutePlanStore() : planStore;
        this.listener = listener == null ? ColonyListener.NONE : listener;
    }

    /**
     * Solves one request.
     *
     * @param request solve request.
     * @return response carrying either the stored plan or the already-exists status.
     * @throws ConfigurationException when request contracts fail.
     */
    @Override
    public SolveResponse solve(SolveRequest request) {
        if (request == null) {
            throw new ConfigurationException(REASON_REQUEST_REQUIRED, "solve request must be non-null");
        }
        String solutionId = request.getSolutionId();
        if (solutionId == null || solutionId.isBlank()) {
            throw new ConfigurationException(REASON_SOLUTION_ID_REQUIRED, "solutionId must be non-blank");
        }
        if (planStore.exists(solutionId)) {
            log.info("Solution with id '{}' already exists, skipping", solutionId);
            return alreadyExists(solutionId);
        }

        requireLimit(REASON_PALLET_LIMIT_INVALID, "palletLimit", request.getPalletLimit());
        requireLimit(REASON_WEIGHT_LIMIT_INVALID, "weightLimit", request.getWeightLimit());
        ColonyParameters parameters = request.getParameters() == null
                ? ColonyParameters.defaults()
                : request.getParameters();
        parameters.validate();

        PointTable points = PointTable.bind(request.getPointIds(), request.getOriginId(), pointCatalog);
        points.checkFeasible(request.getPalletLimit(), request.getWeightLimit());
        DistanceMatrix distances = distanceTable.bind(points);

        long seed = request.getSeed() == null ? ThreadLocalRandom.current().nextLong() : request.getSeed();
        log.info("Solving '{}': {} points, {} ants, {} iterations",
                solutionId, points.deliveryCount(), parameters.getAntCount(), parameters.getIterationCount());

        AntColonySearch search = new AntColonySearch(
                points,
                distances,
                request.getPalletLimit(),
                request.getWeightLimit(),
                parameters,
                listener
        );
        ColonyResult result = search.run(seed);

        RouteDecomposer decomposer = new RouteDecomposer(request.getRouteNamePrefix());
        RoutePlan plan = decomposer.plan(solutionId, result.getBestTour(), distances);
        if (!planStore.save(StoredRoutePlan.of(plan))) {
            log.info("Solution with id '{}' was stored concurrently, discarding this run", solutionId);
            return alreadyExists(solutionId);
        }

        log.info("Solved '{}': length={}, routes={}, stops={}, elapsed={} ms",
                solutionId,
                String.format("%.2f", result.bestLength()),
                plan.routeCount(),
                plan.getRecords().size(),
                TimeUnit.NANOSECONDS.toMillis(result.getTelemetry().getElapsedNanos()));

        return SolveResponse.builder()
                .status(SolveStatus.SOLVED)
                .solutionId(solutionId)
                .message("CVRP solved successfully. Solution ID: " + solutionId)
                .bestTour(result.getBestTour().toPointIds(points))
                .totalLength(result.bestLength())
                .plan(plan)
                .telemetry(result.getTelemetry())
                .build();
    }

    /**
     * @return store this solver writes to.
     */
    public RoutePlanStore planStore() {
        return planStore;
    }

    private static SolveResponse alreadyExists(String solutionId) {
        return SolveResponse.builder()
                .status(SolveStatus.ALREADY_EXISTS)
                .solutionId(solutionId)
                .message("Solution " + solutionId + " already exists")
                .bestTour(List.of())
                .totalLength(Double.POSITIVE_INFINITY)
                .build();
    }

    private static void requireLimit(String reasonCode, String name, double limit) {
        if (!Double.isFinite(limit) || limit < 0.0d) {
            throw new ConfigurationException(reasonCode, name + " must be finite and >= 0, got " + limit);
        }
    }
}
