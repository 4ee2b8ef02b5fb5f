package io.github.yok.chunkdblink.dataset;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Storage type of a chunk column.
 *
 * <p>
 * Integer types carry their signed value range so that narrowing can check every value against
 * the target width. Variable-width types ({@link #TEXT}, {@link #CATEGORY}) report a fixed width of
 * {@code -1}; their footprint is computed from the values by {@link MemoryFootprint}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum ColumnType {

    // true/false literals
    BOOLEAN(1, 0, 0),

    // 8-bit signed integer
    INT8(1, Byte.MIN_VALUE, Byte.MAX_VALUE),

    // 16-bit signed integer
    INT16(2, Short.MIN_VALUE, Short.MAX_VALUE),

    // 32-bit signed integer
    INT32(4, Integer.MIN_VALUE, Integer.MAX_VALUE),

    // 64-bit signed integer, the width every integer column is parsed into
    INT64(8, Long.MIN_VALUE, Long.MAX_VALUE),

    // double-precision floating point
    FLOAT64(8, 0, 0),

    // free text
    TEXT(-1, 0, 0),

    // dictionary-encoded text
    CATEGORY(-1, 0, 0);

    // Bytes per value for fixed-width types, -1 for variable-width types
    private final int fixedWidth;

    // Smallest representable value (integer types only)
    private final long minValue;

    // Largest representable value (integer types only)
    private final long maxValue;

    /**
     * Returns whether this is one of the signed integer types.
     *
     * @return {@code true} for {@link #INT8}, {@link #INT16}, {@link #INT32} and {@link #INT64}
     */
    public boolean isInteger() {
        return this == INT8 || this == INT16 || this == INT32 || this == INT64;
    }

    /**
     * Returns whether values of this type are text, encoded or not.
     *
     * @return {@code true} for {@link #TEXT} and {@link #CATEGORY}
     */
    public boolean isTextual() {
        return this == TEXT || this == CATEGORY;
    }

    /**
     * Returns whether every value in {@code [min, max]} fits this integer type.
     *
     * @param min smallest value of the column
     * @param max largest value of the column
     * @return {@code true} if both bounds are inside this type's range
     */
    public boolean fits(long min, long max) {
        return isInteger() && min >= minValue && max <= maxValue;
    }

    /**
     * Returns the narrowest type able to hold the values of both this type and {@code other}.
     *
     * <p>
     * Integers widen to the larger width, integers and decimals to {@link #FLOAT64}, and any other
     * mix to {@link #TEXT}. {@link #CATEGORY} counts as {@link #TEXT}.
     * </p>
     *
     * @param other type of the incoming values
     * @return common type, never {@link #CATEGORY}
     */
    public ColumnType widen(ColumnType other) {
        ColumnType a = this == CATEGORY ? TEXT : this;
        ColumnType b = other == CATEGORY ? TEXT : other;
        if (a == b) {
            return a;
        }
        if (a.isInteger() && b.isInteger()) {
            return a.fixedWidth >= b.fixedWidth ? a : b;
        }
        if (a.isNumeric() && b.isNumeric()) {
            return FLOAT64;
        }
        return TEXT;
    }

    private boolean isNumeric() {
        return isInteger() || this == FLOAT64;
    }
}
