package org.Aayush.dvrp.routing.colony;

/**
 * Optional observability hooks for a colony search.
 *
 * <p>Callbacks run on the thread driving the iteration loop, never on ant workers.
 * All methods default to no-ops.</p>
 */
public interface ColonyListener {

    /** Listener that ignores every event. */
    ColonyListener NONE = new ColonyListener() {
    };

    /**
     * Called once before the first iteration.
     *
     * @param deliveryCount number of non-origin points.
     * @param parameters validated search parameters.
     * @param seed seed of the run.
     */
    default void onSearchStarted(int deliveryCount, ColonyParameters parameters, long seed) {
    }

    /**
     * Called when a tour becomes the new global best.
     */
    default void onBestImproved(int iteration, int ant, double length) {
    }

    /**
     * Called after the trail update of each iteration.
     */
    default void onIterationCompleted(IterationSummary summary) {
    }
}
