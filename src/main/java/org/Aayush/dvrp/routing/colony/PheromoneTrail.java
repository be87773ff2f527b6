package org.Aayush.dvrp.routing.colony;

import java.util.Arrays;

/**
 * Square pheromone matrix over point positions.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>Every entry starts at the initial value and stays finite and {@code >= 0}: evaporation
 * multiplies by a retention factor in [0, 1] and deposits add non-negative finite amounts,
 * saturating at {@link Double#MAX_VALUE}.</li>
 * <li>Two phases per round. {@link #beginConstruction()} freezes the trail so ants can read it
 * concurrently; {@link #beginUpdate()} reopens it for the single writer.</li>
 * <li>Writes while frozen fail with {@link IllegalStateException}.</li>
 * </ul>
 */
public final class PheromoneTrail {
    public static final double INITIAL_PHEROMONE = 1.0d;

    private final int size;
    private final double[] values;
    private volatile boolean frozen;

    /**
     * Creates a trail with every entry set to {@link #INITIAL_PHEROMONE}.
     */
    public PheromoneTrail(int size) {
        this(size, INITIAL_PHEROMONE);
    }

    /**
     * Creates a trail with every entry set to {@code initialValue}.
     */
    public PheromoneTrail(int size, double initialValue) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        if (!Double.isFinite(initialValue) || initialValue < 0.0d) {
            throw new IllegalArgumentException("initialValue must be finite and >= 0");
        }
        this.size = size;
        this.values = new double[size * size];
        Arrays.fill(values, initialValue);
    }

    public int size() {
        return size;
    }

    public double get(int from, int to) {
        return values[index(from, to)];
    }

    /**
     * Multiplies every entry by {@code retention}.
     *
     * @param retention factor in [0, 1].
     */
    public void evaporate(double retention) {
        requireWritable();
        if (!(retention >= 0.0d && retention <= 1.0d)) {
            throw new IllegalArgumentException("retention must be in [0, 1], got " + retention);
        }
        for (int i = 0; i < values.length; i++) {
            values[i] *= retention;
        }
    }

    /**
     * Adds {@code amount} to one directed edge.
     *
     * @param amount finite non-negative amount.
     */
    public void deposit(int from, int to, double amount) {
        requireWritable();
        requireAmount(amount);
        int index = index(from, to);
        values[index] = saturatingAdd(values[index], amount);
    }

    /**
     * Adds {@code amount} to every consecutive edge of a path and to the wrap edge from its
     * last position back to its first.
     */
    public void depositAlong(int[] path, double amount) {
        requireWritable();
        requireAmount(amount);
        if (path.length == 0) {
            return;
        }
        for (int i = 0; i + 1 < path.length; i++) {
            int index = index(path[i], path[i + 1]);
            values[index] = saturatingAdd(values[index], amount);
        }
        int wrap = index(path[path.length - 1], path[0]);
        values[wrap] = saturatingAdd(values[wrap], amount);
    }

    /**
     * Freezes the trail for the read-only construction phase.
     */
    public void beginConstruction() {
        frozen = true;
    }

    /**
     * Reopens the trail for the evaporate/deposit phase.
     */
    public void beginUpdate() {
        frozen = false;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * @return row-major copy of the current entries.
     */
    public double[][] snapshot() {
        double[][] copy = new double[size][size];
        for (int row = 0; row < size; row++) {
            System.arraycopy(values, row * size, copy[row], 0, size);
        }
        return copy;
    }

    private int index(int from, int to) {
        if (from < 0 || from >= size || to < 0 || to >= size) {
            throw new IndexOutOfBoundsException("edge (" + from + ", " + to + ") outside [0, " + size + ")");
        }
        return from * size + to;
    }

    private void requireWritable() {
        if (frozen) {
            throw new IllegalStateException("pheromone trail is frozen while ants are constructing");
        }
    }

    private static double saturatingAdd(double value, double amount) {
        return Math.min(value + amount, Double.MAX_VALUE);
    }

    private static void requireAmount(double amount) {
        if (!Double.isFinite(amount) || amount < 0.0d) {
            throw new IllegalArgumentException("deposit amount must be finite and >= 0, got " + amount);
        }
    }
}
