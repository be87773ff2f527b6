package org.Aayush.dvrp.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.dvrp.routing.colony.ColonyParameters;

import java.util.List;

/**
 * Client-facing solve request.
 *
 * <p>Point ids are resolved against the solver's point catalog. The origin may be listed or
 * omitted; it is added when missing.</p>
 */
@Value
@Builder
public class SolveRequest {
    /** Name of the solution to produce; also the idempotency key. */
    String solutionId;
    /** Identifier of the distribution center. */
    String originId;
    /** Points to deliver, in the order positions are assigned. */
    @Singular("pointId")
    List<String> pointIds;
    /** Pallet capacity of one route. */
    double palletLimit;
    /** Weight capacity of one route. */
    double weightLimit;
    /** Search parameters; {@code null} selects {@link ColonyParameters#defaults()}. */
    ColonyParameters parameters;
    /** Search seed; {@code null} draws a fresh one, echoed in the response telemetry. */
    Long seed;
    /** Route name prefix; {@code null} selects {@code Tractor}. */
    String routeNamePrefix;
}
