package org.Aayush.dvrp.routing.store;

import java.util.Optional;

/**
 * Persistence contract for solved route plans, keyed by solution id.
 *
 * <p>A solution id is written at most once. Implementations must make {@link #save(StoredRoutePlan)}
 * atomic: either every record and the origin record become visible, or nothing does.</p>
 */
public interface RoutePlanStore {

    /**
     * @param solutionId solution identifier.
     * @return whether a plan is already stored under the id.
     */
    boolean exists(String solutionId);

    /**
     * Stores a plan unless its solution id is already present.
     *
     * @param plan plan to store.
     * @return true when stored, false when the id already existed (nothing is overwritten).
     */
    boolean save(StoredRoutePlan plan);

    /**
     * @param solutionId solution identifier.
     * @return stored plan, or empty when absent.
     */
    Optional<StoredRoutePlan> find(String solutionId);
}
