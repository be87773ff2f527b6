package org.Aayush.dvrp.routing.distance;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a distance is requested for a point pair with no recorded entry.
 *
 * <p>Always fatal: a missing pair means the distance data does not cover the requested
 * points, so the running solve is aborted instead of skipping the ant.</p>
 */
@Getter
@Accessors(fluent = true)
public final class UnknownPairException extends RuntimeException {
    public static final String REASON_UNKNOWN_PAIR = "DIST_UNKNOWN_PAIR";

    private final String reasonCode;
    private final String fromPointId;
    private final String toPointId;

    /**
     * Creates a failure for one undefined ordered pair.
     *
     * @param fromPointId origin identifier of the lookup.
     * @param toPointId destination identifier of the lookup.
     */
    public UnknownPairException(String fromPointId, String toPointId) {
        super("[" + REASON_UNKNOWN_PAIR + "] no distance recorded for pair (" + fromPointId + ", " + toPointId + ")");
        this.reasonCode = REASON_UNKNOWN_PAIR;
        this.fromPointId = fromPointId;
        this.toPointId = toPointId;
    }
}
