package org.Aayush.dvrp.routing.colony;

import java.util.Optional;

/**
 * Running minimum over every tour offered during one search.
 *
 * <p>Updates use strict less-than, so the earliest of equally short tours is kept.
 * Not thread-safe; owned by the iteration loop.</p>
 */
public final class BestTourTracker {
    private Tour best;
    private double bestLength = Double.POSITIVE_INFINITY;
    private int bestIteration = -1;
    private int bestAnt = -1;
    private int improvements;

    /**
     * Offers one constructed tour.
     *
     * @return true when the tour became the new best.
     */
    public boolean offer(Tour tour, int iteration, int ant) {
        if (tour.length() < bestLength) {
            best = tour;
            bestLength = tour.length();
            bestIteration = iteration;
            bestAnt = ant;
            improvements++;
            return true;
        }
        return false;
    }

    public Optional<Tour> best() {
        return Optional.ofNullable(best);
    }

    /**
     * @return best length so far, {@code +INF} before the first offer.
     */
    public double bestLength() {
        return bestLength;
    }

    /**
     * @return iteration of the current best, {@code -1} when absent.
     */
    public int bestIteration() {
        return bestIteration;
    }

    /**
     * @return ant index of the current best, {@code -1} when absent.
     */
    public int bestAnt() {
        return bestAnt;
    }

    public int improvements() {
        return improvements;
    }
}
