package org.Aayush.dvrp.routing.colony;

import lombok.Value;

/**
 * Best tour of a colony search plus its telemetry.
 */
@Value
public class ColonyResult {
    Tour bestTour;
    ColonyTelemetry telemetry;

    public double bestLength() {
        return bestTour.length();
    }
}
