package org.Aayush.dvrp.routing.colony;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

@DisplayName("Tour Tests")
class TourTest {

    @Test
    @DisplayName("Immutability: neither the source array nor the returned array alias the tour")
    void testPositionsAreCopied() {
        int[] source = {3, 0, 1, 3};
        Tour tour = new Tour(source, 4.0d);

        source[1] = 99;
        tour.positions()[2] = 99;

        assertArrayEquals(new int[]{3, 0, 1, 3}, tour.positions());
    }

    @Test
    @DisplayName("Equality: tours compare by visiting order and length")
    void testValueEquality() {
        Tour tour = new Tour(new int[]{2, 0, 1, 2}, 7.5d);
        Tour same = new Tour(new int[]{2, 0, 1, 2}, 7.5d);

        assertEquals(tour, same);
        assertEquals(tour.hashCode(), same.hashCode());
        assertNotEquals(tour, new Tour(new int[]{2, 1, 0, 2}, 7.5d));
        assertNotEquals(tour, new Tour(new int[]{2, 0, 1, 2}, 8.0d));
        assertEquals("Tour[positions=[2, 0, 1, 2], length=7.5]", tour.toString());
    }
}
