package org.Aayush.dvrp.routing.colony;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.dvrp.routing.distance.DistanceMatrix;
import org.Aayush.dvrp.routing.point.PointTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Colony iteration loop.
 * <p>
 * Each iteration runs in two phases:
 * </p>
 * <ul>
 * <li>Construction: the trail is frozen and {@code antCount} independent tours are built,
 * sequentially or on a worker pool. {@code invokeAll} is the barrier closing the phase.</li>
 * <li>Update: tours are offered to the {@link BestTourTracker} in ant order, the trail is
 * evaporated once, then every ant deposits {@code Q / length} along its whole tour.</li>
 * </ul>
 * <p>
 * Every ant draws from its own stream seeded from {@code (seed, iteration, ant)}, so a fixed
 * seed gives the same best tour whatever the parallelism.
 * </p>
 */
@Slf4j
public final class AntColonySearch {
    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final PointTable points;
    private final ColonyParameters parameters;
    private final TourConstructor constructor;
    private final ColonyListener listener;

    /**
     * Creates a search over one bound problem instance.
     *
     * @param points bound point table.
     * @param distances positional distances for {@code points}.
     * @param palletLimit pallet capacity per route.
     * @param weightLimit weight capacity per route.
     * @param parameters search parameters, validated here.
     * @param listener observability hooks, or {@code null} for none.
     */
    public AntColonySearch(
            PointTable points,
            DistanceMatrix distances,
            double palletLimit,
            double weightLimit,
            ColonyParameters parameters,
            ColonyListener listener
    ) {
        this.points = Objects.requireNonNull(points, "points");
        this.parameters = Objects.requireNonNull(parameters, "parameters").validate();
        this.constructor = new TourConstructor(
                points, distances, palletLimit, weightLimit, parameters.getAlpha(), parameters.getBeta());
        this.listener = listener == null ? ColonyListener.NONE : listener;
    }

    /**
     * Runs every iteration and returns the best tour.
     *
     * @param seed seed for all ant streams.
     * @return best tour and telemetry.
     * @throws org.Aayush.dvrp.routing.distance.UnknownPairException when any ant hits a missing distance.
     */
    public ColonyResult run(long seed) {
        long startNanos = System.nanoTime();
        long budgetNanos = parameters.hasSearchDeadline()
                ? TimeUnit.MILLISECONDS.toNanos(parameters.getMaxSearchMillis())
                : Long.MAX_VALUE;

        PheromoneTrail trail = new PheromoneTrail(points.size());
        BestTourTracker tracker = new BestTourTracker();
        int antCount = parameters.getAntCount();
        int parallelism = Math.min(parameters.getParallelism(), antCount);
        long toursConstructed = 0L;
        int iterationsCompleted = 0;
        boolean deadlineReached = false;

        listener.onSearchStarted(points.deliveryCount(), parameters, seed);
        log.debug("colony search started: points={}, ants={}, iterations={}, parallelism={}, seed={}",
                points.deliveryCount(), antCount, parameters.getIterationCount(), parallelism, seed);

        ExecutorService workers = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, workerThreads()) : null;
        try {
            for (int iteration = 0; iteration < parameters.getIterationCount(); iteration++) {
                if (iteration > 0 && System.nanoTime() - startNanos >= budgetNanos) {
                    deadlineReached = true;
                    log.debug("colony search budget of {} ms reached after {} iterations",
                            parameters.getMaxSearchMillis(), iteration);
                    break;
                }

                trail.beginConstruction();
                List<Tour> tours = workers == null
                        ? constructSequential(trail, seed, iteration)
                        : constructParallel(workers, trail, seed, iteration);
                trail.beginUpdate();

                double iterationBest = Double.POSITIVE_INFINITY;
                boolean improved = false;
                for (int ant = 0; ant < tours.size(); ant++) {
                    Tour tour = tours.get(ant);
                    iterationBest = Math.min(iterationBest, tour.length());
                    if (tracker.offer(tour, iteration, ant)) {
                        improved = true;
                        listener.onBestImproved(iteration, ant, tour.length());
                    }
                }

                trail.evaporate(parameters.getEvaporationRate());
                for (Tour tour : tours) {
                    // Q / 0 is undefined; a zero-length tour carries no signal
                    if (tour.length() > 0.0d) {
                        trail.depositAlong(tour.positions(), depositAmount(tour.length()));
                    }
                }

                toursConstructed += tours.size();
                iterationsCompleted++;
                listener.onIterationCompleted(IterationSummary.builder()
                        .iteration(iteration)
                        .toursConstructed(tours.size())
                        .iterationBestLength(iterationBest)
                        .globalBestLength(tracker.bestLength())
                        .improved(improved)
                        .build());
                log.debug("iteration {} done: iterationBest={}, globalBest={}",
                        iteration, iterationBest, tracker.bestLength());
            }
        } finally {
            trail.beginUpdate();
            if (workers != null) {
                workers.shutdownNow();
            }
        }

        Tour best = tracker.best().orElseThrow(() -> new IllegalStateException("colony search produced no tour"));
        ColonyTelemetry telemetry = ColonyTelemetry.builder()
                .seed(seed)
                .iterationsCompleted(iterationsCompleted)
                .antsPerIteration(antCount)
                .toursConstructed(toursConstructed)
                .bestImprovements(tracker.improvements())
                .bestIteration(tracker.bestIteration())
                .bestAnt(tracker.bestAnt())
                .bestLength(tracker.bestLength())
                .parallelism(parallelism)
                .elapsedNanos(System.nanoTime() - startNanos)
                .deadlineReached(deadlineReached)
                .build();
        return new ColonyResult(best, telemetry);
    }

    /**
     * {@code Q / length}, capped at {@link Double#MAX_VALUE} when a large {@code Q} meets a short tour.
     */
    private double depositAmount(double length) {
        return Math.min(parameters.getDepositConstant() / length, Double.MAX_VALUE);
    }

    private List<Tour> constructSequential(PheromoneTrail trail, long seed, int iteration) {
        List<Tour> tours = new ArrayList<>(parameters.getAntCount());
        for (int ant = 0; ant < parameters.getAntCount(); ant++) {
            tours.add(constructor.construct(trail, antRandom(seed, iteration, ant)));
        }
        return tours;
    }

    private List<Tour> constructParallel(ExecutorService workers, PheromoneTrail trail, long seed, int iteration) {
        List<Callable<Tour>> tasks = new ArrayList<>(parameters.getAntCount());
        for (int ant = 0; ant < parameters.getAntCount(); ant++) {
            SplittableRandom random = antRandom(seed, iteration, ant);
            tasks.add(() -> constructor.construct(trail, random));
        }

        List<Future<Tour>> futures;
        try {
            futures = workers.invokeAll(tasks);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("colony search interrupted during iteration " + iteration, ex);
        }

        List<Tour> tours = new ArrayList<>(futures.size());
        for (Future<Tour> future : futures) {
            tours.add(await(future, iteration));
        }
        return tours;
    }

    private static Tour await(Future<Tour> future, int iteration) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("colony search interrupted during iteration " + iteration, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("ant construction failed in iteration " + iteration, cause);
        }
    }

    /**
     * Derives an independent stream for one ant.
     */
    static SplittableRandom antRandom(long seed, int iteration, int ant) {
        long mixed = mix64(seed + GOLDEN_GAMMA * (iteration + 1L));
        mixed = mix64(mixed + GOLDEN_GAMMA * (ant + 1L));
        return new SplittableRandom(mixed);
    }

    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "aco-ant-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
