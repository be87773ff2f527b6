package org.Aayush.dvrp.routing.colony;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BestTourTrackerTest {

    @Test
    @DisplayName("Empty tracker reports no best")
    void testEmpty() {
        BestTourTracker tracker = new BestTourTracker();

        assertTrue(tracker.best().isEmpty());
        assertEquals(Double.POSITIVE_INFINITY, tracker.bestLength());
        assertEquals(-1, tracker.bestIteration());
        assertEquals(-1, tracker.bestAnt());
        assertEquals(0, tracker.improvements());
    }

    @Test
    @DisplayName("Only strictly shorter tours replace the best")
    void testStrictImprovement() {
        BestTourTracker tracker = new BestTourTracker();
        Tour first = new Tour(new int[]{0, 1, 0}, 10.0d);
        Tour tie = new Tour(new int[]{0, 2, 0}, 10.0d);
        Tour longer = new Tour(new int[]{0, 3, 0}, 12.0d);
        Tour shorter = new Tour(new int[]{0, 4, 0}, 7.5d);

        assertTrue(tracker.offer(first, 0, 0));
        assertFalse(tracker.offer(tie, 0, 1));
        assertFalse(tracker.offer(longer, 1, 0));
        assertSame(first, tracker.best().orElseThrow());

        assertTrue(tracker.offer(shorter, 2, 3));
        assertSame(shorter, tracker.best().orElseThrow());
        assertEquals(7.5d, tracker.bestLength());
        assertEquals(2, tracker.bestIteration());
        assertEquals(3, tracker.bestAnt());
        assertEquals(2, tracker.improvements());
    }
}
