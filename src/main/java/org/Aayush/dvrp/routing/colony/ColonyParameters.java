package org.Aayush.dvrp.routing.colony;

import lombok.Builder;
import lombok.Value;
import org.Aayush.dvrp.core.error.ConfigurationException;

/**
 * Immutable search parameters for one colony run.
 *
 * <p>{@link #defaults()} reads JVM system properties so deployments can tune the colony
 * without code changes; every missing or unparseable property falls back to the built-in value.</p>
 */
@Value
@Builder(toBuilder = true)
public class ColonyParameters {
    public static final String REASON_ANT_COUNT_INVALID = "CFG_ANT_COUNT_INVALID";
    public static final String REASON_ITERATION_COUNT_INVALID = "CFG_ITERATION_COUNT_INVALID";
    public static final String REASON_ALPHA_INVALID = "CFG_ALPHA_INVALID";
    public static final String REASON_BETA_INVALID = "CFG_BETA_INVALID";
    public static final String REASON_EVAPORATION_RATE_INVALID = "CFG_EVAPORATION_RATE_INVALID";
    public static final String REASON_DEPOSIT_CONSTANT_INVALID = "CFG_DEPOSIT_CONSTANT_INVALID";
    public static final String REASON_PARALLELISM_INVALID = "CFG_PARALLELISM_INVALID";

    public static final int DEFAULT_ANT_COUNT = 30;
    public static final int DEFAULT_ITERATION_COUNT = 50;
    public static final double DEFAULT_ALPHA = 1.0d;
    public static final double DEFAULT_BETA = 1.0d;
    public static final double DEFAULT_EVAPORATION_RATE = 0.5d;
    public static final double DEFAULT_DEPOSIT_CONSTANT = 1.0d;
    public static final int DEFAULT_PARALLELISM = 1;
    public static final long UNBOUNDED_SEARCH_MILLIS = 0L;

    public static final String PROP_ANT_COUNT = "dvrp.aco.ants";
    public static final String PROP_ITERATION_COUNT = "dvrp.aco.iterations";
    public static final String PROP_ALPHA = "dvrp.aco.alpha";
    public static final String PROP_BETA = "dvrp.aco.beta";
    public static final String PROP_EVAPORATION_RATE = "dvrp.aco.evaporationRate";
    public static final String PROP_DEPOSIT_CONSTANT = "dvrp.aco.depositConstant";
    public static final String PROP_PARALLELISM = "dvrp.aco.parallelism";
    public static final String PROP_MAX_SEARCH_MILLIS = "dvrp.aco.maxSearchMillis";

    /** Ants constructing a tour in every iteration. */
    int antCount;
    /** Number of construct/update rounds. */
    int iterationCount;
    /** Pheromone exponent in the transition rule. */
    double alpha;
    /** Distance exponent in the transition rule. */
    double beta;
    /**
     * Multiplicative retention factor applied to the whole trail once per iteration,
     * in range [0, 1). A value of 0.5 halves every entry.
     */
    double evaporationRate;
    /** Deposit constant {@code Q}; each edge of a tour of length L receives {@code Q / L}. */
    double depositConstant;
    /** Worker threads constructing the ants of one round; 1 runs sequentially. */
    int parallelism;
    /** Wall-clock budget checked between iterations; {@code <= 0} means unbounded. */
    long maxSearchMillis;

    /**
     * Returns parameters from system properties with built-in fallbacks.
     */
    public static ColonyParameters defaults() {
        return ColonyParameters.builder()
                .antCount(readInt(PROP_ANT_COUNT, DEFAULT_ANT_COUNT))
                .iterationCount(readInt(PROP_ITERATION_COUNT, DEFAULT_ITERATION_COUNT))
                .alpha(readDouble(PROP_ALPHA, DEFAULT_ALPHA))
                .beta(readDouble(PROP_BETA, DEFAULT_BETA))
                .evaporationRate(readDouble(PROP_EVAPORATION_RATE, DEFAULT_EVAPORATION_RATE))
                .depositConstant(readDouble(PROP_DEPOSIT_CONSTANT, DEFAULT_DEPOSIT_CONSTANT))
                .parallelism(readInt(PROP_PARALLELISM, DEFAULT_PARALLELISM))
                .maxSearchMillis(readLong(PROP_MAX_SEARCH_MILLIS, UNBOUNDED_SEARCH_MILLIS))
                .build();
    }

    /**
     * Validates parameter ranges.
     *
     * @return this instance for chaining.
     * @throws ConfigurationException for the first invalid parameter.
     */
    public ColonyParameters validate() {
        if (antCount <= 0) {
            throw new ConfigurationException(REASON_ANT_COUNT_INVALID, "antCount must be > 0, got " + antCount);
        }
        if (iterationCount <= 0) {
            throw new ConfigurationException(
                    REASON_ITERATION_COUNT_INVALID, "iterationCount must be > 0, got " + iterationCount);
        }
        if (!Double.isFinite(alpha) || alpha < 0.0d) {
            throw new ConfigurationException(REASON_ALPHA_INVALID, "alpha must be finite and >= 0, got " + alpha);
        }
        if (!Double.isFinite(beta) || beta < 0.0d) {
            throw new ConfigurationException(REASON_BETA_INVALID, "beta must be finite and >= 0, got " + beta);
        }
        if (!(evaporationRate >= 0.0d && evaporationRate < 1.0d)) {
            throw new ConfigurationException(
                    REASON_EVAPORATION_RATE_INVALID, "evaporationRate must be in [0, 1), got " + evaporationRate);
        }
        if (!Double.isFinite(depositConstant) || depositConstant <= 0.0d) {
            throw new ConfigurationException(
                    REASON_DEPOSIT_CONSTANT_INVALID, "depositConstant must be finite and > 0, got " + depositConstant);
        }
        if (parallelism <= 0) {
            throw new ConfigurationException(REASON_PARALLELISM_INVALID, "parallelism must be > 0, got " + parallelism);
        }
        return this;
    }

    /**
     * @return whether a wall-clock budget applies.
     */
    public boolean hasSearchDeadline() {
        return maxSearchMillis > 0L;
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
