package org.Aayush.dvrp.core.id;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilPositionIndexTest {

    private List<String> standardIds;

    @BeforeEach
    void setUp() {
        standardIds = List.of("DC", "Store_17", "Store_42");
    }

    @Test
    @DisplayName("Baseline Correctness: positions follow list order")
    void testPositionsFollowListOrder() {
        PositionIndex index = PositionIndex.ofOrdered(standardIds);

        assertEquals(0, index.positionOf("DC"));
        assertEquals(2, index.positionOf("Store_42"));

        assertEquals("Store_17", index.idAt(1));

        assertTrue(index.containsId("DC"));
        assertFalse(index.containsId("Store_99"));
        assertFalse(index.containsId(null));

        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("Exception Path: unknown point id")
    void testUnknownPointId() {
        PositionIndex index = new FastUtilPositionIndex(standardIds);

        assertThrows(PositionIndex.UnknownPointIdException.class, () -> index.positionOf("Atlantis"));
        assertThrows(IllegalArgumentException.class, () -> index.positionOf(null));
    }

    @Test
    @DisplayName("Exception Path: position out of bounds")
    void testInvalidPosition() {
        PositionIndex index = new FastUtilPositionIndex(standardIds);

        assertThrows(IndexOutOfBoundsException.class, () -> index.idAt(3));
        assertThrows(IndexOutOfBoundsException.class, () -> index.idAt(-1));
    }

    @Test
    @DisplayName("Constructor Validation: duplicate and null ids are rejected")
    void testRejectDuplicateAndNullIds() {
        IllegalArgumentException duplicate = assertThrows(
                IllegalArgumentException.class,
                () -> new FastUtilPositionIndex(List.of("A", "B", "A"))
        );
        assertTrue(duplicate.getMessage().contains("Duplicate point id A"));

        assertThrows(IllegalArgumentException.class, () -> new FastUtilPositionIndex(Arrays.asList("A", null)));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilPositionIndex(null));
    }

    @Test
    @DisplayName("Edge Case: empty index")
    void testEmptyIndex() {
        PositionIndex index = PositionIndex.ofOrdered(List.of());
        assertEquals(0, index.size());
        assertThrows(IndexOutOfBoundsException.class, () -> index.idAt(0));
    }

    @Test
    @DisplayName("Concurrency: parallel readers see consistent mapping")
    void testConcurrentReads() throws InterruptedException {
        int size = 2_000;
        List<String> ids = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ids.add("P" + i);
        }
        PositionIndex index = PositionIndex.ofOrdered(ids);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicInteger failures = new AtomicInteger();
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                for (int i = 0; i < size; i++) {
                    if (index.positionOf("P" + i) != i || !index.idAt(i).equals("P" + i)) {
                        failures.incrementAndGet();
                    }
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(0, failures.get());
    }
}
