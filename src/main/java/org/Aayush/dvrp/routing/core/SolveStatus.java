package org.Aayush.dvrp.routing.core;

/**
 * Outcome of one solve call.
 */
public enum SolveStatus {
    /** The search ran and its plan was stored. */
    SOLVED,
    /** A plan with the same solution id was already stored; nothing was computed or written. */
    ALREADY_EXISTS
}
