package com.gmlparser.sanitize;

import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import java.util.function.IntUnaryOperator;

/**
 * Translates an offset in sanitized text back to the original text:
 * {@code i - (number of insertion offsets <= i)}.
 */
public final class IndexMapper implements IntUnaryOperator {
    private static final IndexMapper IDENTITY = new IndexMapper(new int[0]);

    private final int[] offsets;

    private IndexMapper(int[] offsets) {
        this.offsets = offsets;
    }

    public static IndexMapper identity() {
        return IDENTITY;
    }

    /**
     * Null entries and duplicates are ignored; the identity mapper is returned when nothing
     * remains.
     */
    public static IndexMapper of(List<Integer> insertPositions) {
        if (insertPositions == null || insertPositions.isEmpty()) {
            return IDENTITY;
        }
        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer position : insertPositions) {
            if (position != null) {
                sorted.add(position);
            }
        }
        if (sorted.isEmpty()) {
            return IDENTITY;
        }
        return new IndexMapper(sorted.stream().mapToInt(Integer::intValue).toArray());
    }

    public boolean isIdentity() {
        return offsets.length == 0;
    }

    public int map(int index) {
        if (offsets.length == 0) {
            return index;
        }
        // insertion point of the first offset > index equals count(offsets <= index)
        int low = 0;
        int high = offsets.length;
        while (low < high) {
            int middle = (low + high) >>> 1;
            if (offsets[middle] <= index) {
                low = middle + 1;
            } else {
                high = middle;
            }
        }
        return index - low;
    }

    @Override
    public int applyAsInt(int operand) {
        return map(operand);
    }

    @Override
    public String toString() {
        return "IndexMapper" + Arrays.toString(offsets);
    }
}
