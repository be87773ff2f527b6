package org.Aayush.dvrp.routing.distance;

import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Objects;

/**
 * Hash-backed {@link DistanceTable} over ordered identifier pairs.
 * <p>
 * Identifiers are interned to dense ints and each ordered pair is packed into one
 * {@code long} key, so lookups are O(1) expected without boxing.
 * Immutable after {@link Builder#build()}; safe for concurrent readers.
 * </p>
 */
public final class PairwiseDistanceTable implements DistanceTable {
    private static final int ABSENT = -1;

    private final Object2IntOpenHashMap<String> idCodes;
    private final Long2DoubleOpenHashMap distances;

    private PairwiseDistanceTable(Object2IntOpenHashMap<String> idCodes, Long2DoubleOpenHashMap distances) {
        this.idCodes = idCodes;
        this.distances = distances;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public double distance(String fromPointId, String toPointId) {
        long key = keyOf(fromPointId, toPointId);
        if (key == ABSENT || !distances.containsKey(key)) {
            throw new UnknownPairException(fromPointId, toPointId);
        }
        return distances.get(key);
    }

    @Override
    public boolean contains(String fromPointId, String toPointId) {
        long key = keyOf(fromPointId, toPointId);
        return key != ABSENT && distances.containsKey(key);
    }

    /**
     * @return number of recorded ordered pairs.
     */
    public int pairCount() {
        return distances.size();
    }

    private long keyOf(String fromPointId, String toPointId) {
        if (fromPointId == null || toPointId == null) {
            return ABSENT;
        }
        int from = idCodes.getInt(fromPointId);
        int to = idCodes.getInt(toPointId);
        if (from == ABSENT || to == ABSENT) {
            return ABSENT;
        }
        return pack(from, to);
    }

    private static long pack(int from, int to) {
        return ((long) from << 32) | (to & 0xFFFFFFFFL);
    }

    /**
     * Mutable builder; not thread-safe.
     */
    public static final class Builder {
        private final Object2IntOpenHashMap<String> idCodes = new Object2IntOpenHashMap<>();
        private final Long2DoubleOpenHashMap distances = new Long2DoubleOpenHashMap();

        private Builder() {
            idCodes.defaultReturnValue(ABSENT);
        }

        /**
         * Records the distance of one ordered pair, replacing any earlier entry.
         *
         * @throws IllegalArgumentException on null ids or a negative/non-finite distance.
         */
        public Builder put(String fromPointId, String toPointId, double distance) {
            Objects.requireNonNull(fromPointId, "fromPointId");
            Objects.requireNonNull(toPointId, "toPointId");
            if (!Double.isFinite(distance) || distance < 0.0d) {
                throw new IllegalArgumentException(
                        "distance (" + fromPointId + ", " + toPointId + ") must be finite and >= 0, got " + distance
                );
            }
            distances.put(pack(intern(fromPointId), intern(toPointId)), distance);
            return this;
        }

        /**
         * Records the same distance in both directions.
         */
        public Builder putSymmetric(String a, String b, double distance) {
            put(a, b, distance);
            return put(b, a, distance);
        }

        public PairwiseDistanceTable build() {
            Object2IntOpenHashMap<String> frozenIds = new Object2IntOpenHashMap<>(idCodes);
            frozenIds.defaultReturnValue(ABSENT);
            frozenIds.trim();
            Long2DoubleOpenHashMap frozenDistances = new Long2DoubleOpenHashMap(distances);
            frozenDistances.trim();
            return new PairwiseDistanceTable(frozenIds, frozenDistances);
        }

        private int intern(String pointId) {
            int code = idCodes.getInt(pointId);
            if (code == ABSENT) {
                code = idCodes.size();
                idCodes.put(pointId, code);
            }
            return code;
        }
    }
}
