package org.Aayush.dvrp.routing.colony;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable outcome of one completed colony iteration.
 */
@Value
@Builder
public class IterationSummary {
    /** Zero-based iteration index. */
    int iteration;
    /** Tours constructed in this iteration. */
    int toursConstructed;
    /** Shortest tour length of this iteration. */
    double iterationBestLength;
    /** Shortest tour length over all iterations so far. */
    double globalBestLength;
    /** Whether this iteration produced a new global best. */
    boolean improved;
}
