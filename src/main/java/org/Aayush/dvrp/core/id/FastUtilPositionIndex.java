package org.Aayush.dvrp.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Position index backed by a fastutil open hash map.
 * <p>
 * Immutable after construction and safe for concurrent reads.
 * </p>
 */
public class FastUtilPositionIndex implements PositionIndex {

    private static final int ABSENT = -1;

    // identifier -> position
    private final Object2IntOpenHashMap<String> forward;
    // position -> identifier
    private final String[] reverse;

    /**
     * Builds the index from identifiers in position order.
     */
    public FastUtilPositionIndex(List<String> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("orderedIds cannot be null");
        }
        int size = orderedIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(ABSENT);
        this.reverse = new String[size];

        for (int position = 0; position < size; position++) {
            String pointId = orderedIds.get(position);
            if (pointId == null) {
                throw new IllegalArgumentException("null point id at position " + position);
            }
            int previous = forward.put(pointId, position);
            if (previous != ABSENT) {
                throw new IllegalArgumentException(
                        "Duplicate point id " + pointId + " at positions " + previous + " and " + position
                );
            }
            reverse[position] = pointId;
        }
        this.forward.trim();
    }

    @Override
    public int positionOf(String pointId) throws UnknownPointIdException {
        if (pointId == null) {
            throw new IllegalArgumentException("pointId cannot be null");
        }
        int position = forward.getInt(pointId);
        if (position == ABSENT) {
            throw new UnknownPointIdException("Point id not indexed: " + pointId);
        }
        return position;
    }

    @Override
    public String idAt(int position) {
        if (position < 0 || position >= reverse.length) {
            throw new IndexOutOfBoundsException("Position out of bounds: " + position);
        }
        return reverse[position];
    }

    @Override
    public boolean containsId(String pointId) {
        return pointId != null && forward.containsKey(pointId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
