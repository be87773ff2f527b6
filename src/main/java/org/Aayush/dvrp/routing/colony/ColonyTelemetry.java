package org.Aayush.dvrp.routing.colony;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable telemetry snapshot of one colony search.
 */
@Value
@Builder
public class ColonyTelemetry {

    /**
     * Seed all ant streams were derived from.
     */
    long seed;

    /**
     * Iterations that ran to completion.
     */
    int iterationsCompleted;

    /**
     * Ants per iteration.
     */
    int antsPerIteration;

    /**
     * Total tours constructed over all iterations.
     */
    long toursConstructed;

    /**
     * Number of times the global best improved.
     */
    int bestImprovements;

    /**
     * Iteration that produced the final best tour.
     */
    int bestIteration;

    /**
     * Ant index within {@link #bestIteration} that built the final best tour.
     */
    int bestAnt;

    /**
     * Length of the final best tour.
     */
    double bestLength;

    /**
     * Worker threads used for construction.
     */
    int parallelism;

    /**
     * Wall-clock duration of the search.
     */
    long elapsedNanos;

    /**
     * Whether the search stopped early on its time budget.
     */
    boolean deadlineReached;
}
