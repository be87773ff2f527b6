package org.Aayush.dvrp.routing.core;

/**
 * Client-facing route planning contract.
 */
public interface RoutePlanningService {

    /**
     * Solves one capacitated delivery request and persists its plan.
     *
     * @param request request in point-identifier space.
     * @return solved plan, or an already-exists status when the solution id is taken.
     */
    SolveResponse solve(SolveRequest request);
}
