package org.Aayush.dvrp.routing.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.dvrp.routing.colony.ColonyTelemetry;
import org.Aayush.dvrp.routing.plan.RoutePlan;

import java.util.List;

/**
 * Client-facing solve response.
 *
 * <p>When {@code status=ALREADY_EXISTS}, {@code bestTour} is empty, {@code totalLength} is
 * {@code +INF} and {@code plan}/{@code telemetry} are {@code null}.</p>
 */
@Value
@Builder
public class SolveResponse {
    SolveStatus status;
    String solutionId;
    /** Human-readable outcome. */
    String message;
    /** Best tour as point ids, origin at both ends and at every route boundary. */
    List<String> bestTour;
    /** Length of the best tour. */
    double totalLength;
    /** Decomposed and stored plan. */
    RoutePlan plan;
    /** Search telemetry. */
    ColonyTelemetry telemetry;

    public boolean isSolved() {
        return status == SolveStatus.SOLVED;
    }
}
