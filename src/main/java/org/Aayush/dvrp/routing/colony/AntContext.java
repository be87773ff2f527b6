package org.Aayush.dvrp.routing.colony;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Thread-confined mutable state of one ant while it builds a tour.
 *
 * <p>Visitation is tracked over non-origin positions only; the origin is re-entered for every
 * new route and never counts as visited.</p>
 */
final class AntContext {
    private final int originPosition;
    private final IntArrayList unvisited;
    private final IntArrayList path;
    private final double[] scores;

    private int current;
    private double pallets;
    private double weight;
    private double length;

    AntContext(int pointCount, int originPosition) {
        this.originPosition = originPosition;
        this.unvisited = new IntArrayList(pointCount - 1);
        for (int position = 0; position < pointCount; position++) {
            if (position != originPosition) {
                unvisited.add(position);
            }
        }
        this.path = new IntArrayList(pointCount * 2);
        this.scores = new double[pointCount - 1];
        this.current = originPosition;
        path.add(originPosition);
    }

    int current() {
        return current;
    }

    double pallets() {
        return pallets;
    }

    double weight() {
        return weight;
    }

    boolean hasUnvisited() {
        return !unvisited.isEmpty();
    }

    int unvisitedCount() {
        return unvisited.size();
    }

    int unvisitedAt(int slot) {
        return unvisited.getInt(slot);
    }

    /**
     * Scratch buffer for transition scores, indexed like the unvisited slots.
     */
    double[] scores() {
        return scores;
    }

    /**
     * Moves to the point held in {@code slot} and loads its demand.
     */
    void visit(int slot, double pointPallets, double pointWeight, double edgeLength) {
        int next = unvisited.getInt(slot);
        int lastSlot = unvisited.size() - 1;
        unvisited.set(slot, unvisited.getInt(lastSlot));
        unvisited.removeInt(lastSlot);

        path.add(next);
        pallets += pointPallets;
        weight += pointWeight;
        length += edgeLength;
        current = next;
    }

    /**
     * Closes the current route at the origin and empties the vehicle.
     */
    void returnToOrigin(double edgeLength) {
        path.add(originPosition);
        length += edgeLength;
        pallets = 0.0d;
        weight = 0.0d;
        current = originPosition;
    }

    Tour toTour() {
        return new Tour(path.toIntArray(), length);
    }
}
