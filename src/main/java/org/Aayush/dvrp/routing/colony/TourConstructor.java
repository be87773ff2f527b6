package org.Aayush.dvrp.routing.colony;

import org.Aayush.dvrp.routing.distance.DistanceMatrix;
import org.Aayush.dvrp.routing.point.PointTable;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Builds one ant's tour with capacity-triggered returns to the origin.
 * <p>
 * Transition rule from the current position {@code c} to an unvisited position {@code u}:
 * </p>
 * <pre>
 *   score(u) = pheromone(c, u)^alpha / distance(c, u)^beta
 * </pre>
 * <ul>
 * <li>Scores are sampled proportionally; an all-zero score vector falls back to uniform.</li>
 * <li>Candidates at zero distance score infinitely and are chosen uniformly among themselves.</li>
 * <li>The origin is never a candidate. It is entered only when the sampled point would push
 * pallets or weight over a limit; the sampled point then stays unvisited.</li>
 * </ul>
 * <p>
 * The constructor only reads the trail and distances, so any number of instances may run
 * against a frozen trail at once. Each call needs its own random source.
 * </p>
 */
public final class TourConstructor {
    private final PointTable points;
    private final DistanceMatrix distances;
    private final double palletLimit;
    private final double weightLimit;
    private final double alpha;
    private final double beta;

    /**
     * Creates a constructor bound to one problem instance.
     *
     * @throws org.Aayush.dvrp.routing.point.InfeasiblePointException when a point cannot fit
     * an empty vehicle, since construction would never terminate.
     */
    public TourConstructor(
            PointTable points,
            DistanceMatrix distances,
            double palletLimit,
            double weightLimit,
            double alpha,
            double beta
    ) {
        this.points = Objects.requireNonNull(points, "points");
        this.distances = Objects.requireNonNull(distances, "distances");
        if (distances.size() != points.size()) {
            throw new IllegalArgumentException(
                    "distance matrix size " + distances.size() + " does not match point count " + points.size());
        }
        if (points.deliveryCount() == 0) {
            throw new IllegalArgumentException("point table has no delivery point");
        }
        points.checkFeasible(palletLimit, weightLimit);
        this.palletLimit = palletLimit;
        this.weightLimit = weightLimit;
        this.alpha = alpha;
        this.beta = beta;
    }

    /**
     * Constructs one complete tour.
     *
     * @param trail pheromone trail, read only.
     * @param random the ant's own random stream.
     * @return tour and its length.
     * @throws org.Aayush.dvrp.routing.distance.UnknownPairException when a needed distance is missing.
     */
    public Tour construct(PheromoneTrail trail, SplittableRandom random) {
        int origin = points.originPosition();
        AntContext ant = new AntContext(points.size(), origin);

        int startSlot = random.nextInt(ant.unvisitedCount());
        int start = ant.unvisitedAt(startSlot);
        ant.visit(startSlot, points.pallets(start), points.weight(start), distances.get(origin, start));

        while (ant.hasUnvisited()) {
            int slot = sampleSlot(ant, trail, random);
            int candidate = ant.unvisitedAt(slot);
            double nextPallets = ant.pallets() + points.pallets(candidate);
            double nextWeight = ant.weight() + points.weight(candidate);
            if (nextPallets > palletLimit || nextWeight > weightLimit) {
                ant.returnToOrigin(distances.get(ant.current(), origin));
            } else {
                ant.visit(slot, points.pallets(candidate), points.weight(candidate),
                        distances.get(ant.current(), candidate));
            }
        }

        ant.returnToOrigin(distances.get(ant.current(), origin));
        return ant.toTour();
    }

    private int sampleSlot(AntContext ant, PheromoneTrail trail, SplittableRandom random) {
        int current = ant.current();
        int count = ant.unvisitedCount();
        double[] scores = ant.scores();
        double total = 0.0d;
        int infiniteCount = 0;

        for (int slot = 0; slot < count; slot++) {
            int candidate = ant.unvisitedAt(slot);
            double score = score(trail.get(current, candidate), distances.get(current, candidate));
            scores[slot] = score;
            if (score == Double.POSITIVE_INFINITY) {
                infiniteCount++;
            } else {
                total += score;
            }
        }

        if (infiniteCount > 0) {
            return nthInfinite(scores, count, random.nextInt(infiniteCount));
        }
        if (!(total > 0.0d) || !Double.isFinite(total)) {
            return random.nextInt(count);
        }

        double threshold = random.nextDouble() * total;
        double cumulative = 0.0d;
        int lastPositive = 0;
        for (int slot = 0; slot < count; slot++) {
            if (scores[slot] <= 0.0d) {
                continue;
            }
            cumulative += scores[slot];
            lastPositive = slot;
            if (threshold < cumulative) {
                return slot;
            }
        }
        // rounding can leave threshold == total
        return lastPositive;
    }

    private double score(double pheromone, double distance) {
        double attraction = Math.pow(pheromone, alpha);
        double resistance = Math.pow(distance, beta);
        if (resistance == 0.0d) {
            return attraction > 0.0d ? Double.POSITIVE_INFINITY : 0.0d;
        }
        double score = attraction / resistance;
        return Double.isNaN(score) ? 0.0d : score;
    }

    private static int nthInfinite(double[] scores, int count, int n) {
        int seen = 0;
        for (int slot = 0; slot < count; slot++) {
            if (scores[slot] == Double.POSITIVE_INFINITY) {
                if (seen == n) {
                    return slot;
                }
                seen++;
            }
        }
        throw new IllegalStateException("infinite score slot " + n + " not found");
    }
}
