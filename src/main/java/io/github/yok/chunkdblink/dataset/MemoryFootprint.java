package io.github.yok.chunkdblink.dataset;

import lombok.Generated;

/**
 * Estimates the heap bytes held by a chunk column.
 *
 * <p>
 * The estimate follows the layout of {@link ChunkColumn}:
 * </p>
 * <ul>
 * <li>fixed-width types count the primitive array ({@code rows * width} plus the array header)
 * and, when present, the missing-value {@link java.util.BitSet};</li>
 * <li>text counts a reference array plus each string's object header, backing array header and
 * payload (one byte per char for Latin-1 content, two otherwise);</li>
 * <li>categorical columns count the code array at its stored width plus the dictionary.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MemoryFootprint {

    // Compressed-oops reference size is not assumed
    static final int REFERENCE_BYTES = 8;

    // String object header and fields (24) plus backing byte[] header (16)
    static final int STRING_OVERHEAD_BYTES = 40;

    // Header of any array object
    static final int ARRAY_HEADER_BYTES = 16;

    // BitSet object plus its long[] header
    static final int BITSET_OVERHEAD_BYTES = 24 + ARRAY_HEADER_BYTES;

    /**
     * Prevents instantiation.
     */
    @Generated
    private MemoryFootprint() {}

    /**
     * Returns the estimated footprint of a single string, excluding the reference to it.
     *
     * @param value string value, may be {@code null}
     * @return estimated bytes, {@code 0} for {@code null}
     */
    public static long stringBytes(String value) {
        if (value == null) {
            return 0;
        }
        int bytesPerChar = 1;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0xFF) {
                bytesPerChar = 2;
                break;
            }
        }
        return STRING_OVERHEAD_BYTES + (long) value.length() * bytesPerChar;
    }

    /**
     * Returns the width of a categorical code for a dictionary of the given size.
     *
     * @param categoryCount number of distinct categories
     * @return {@code 1}, {@code 2} or {@code 4} bytes
     */
    public static int codeWidth(int categoryCount) {
        if (categoryCount <= Byte.MAX_VALUE) {
            return 1;
        }
        if (categoryCount <= Short.MAX_VALUE) {
            return 2;
        }
        return 4;
    }

    /**
     * Estimates the footprint of a column.
     *
     * @param column column to measure
     * @return estimated bytes
     */
    public static long of(ChunkColumn column) {
        ColumnType type = column.getType();
        int rows = column.size();
        if (type == ColumnType.CATEGORY) {
            long bytes = ARRAY_HEADER_BYTES + (long) rows * column.storedCodeWidth();
            bytes += ARRAY_HEADER_BYTES;
            for (String category : column.getCategories()) {
                bytes += REFERENCE_BYTES + stringBytes(category);
            }
            return bytes;
        }
        if (type == ColumnType.TEXT) {
            long bytes = ARRAY_HEADER_BYTES + (long) rows * REFERENCE_BYTES;
            for (int i = 0; i < rows; i++) {
                bytes += stringBytes((String) column.getValue(i));
            }
            return bytes;
        }
        long bytes = ARRAY_HEADER_BYTES + (long) rows * type.getFixedWidth();
        long mask = column.missingMaskBytes();
        return mask == 0 ? bytes : bytes + BITSET_OVERHEAD_BYTES + mask;
    }
}
