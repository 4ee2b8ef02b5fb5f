package io.github.yok.chunkdblink.dataset;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * One column of a {@link Chunk}: a name, a storage type and the values of every row.
 *
 * <p>
 * Values are held in one primitive array sized to the storage type:
 * </p>
 * <ul>
 * <li>{@link ColumnType#BOOLEAN}: {@code boolean[]}</li>
 * <li>{@link ColumnType#INT8} / {@link ColumnType#INT16} / {@link ColumnType#INT32} /
 * {@link ColumnType#INT64}: {@code byte[]} / {@code short[]} / {@code int[]} /
 * {@code long[]}</li>
 * <li>{@link ColumnType#FLOAT64}: {@code double[]}</li>
 * <li>{@link ColumnType#TEXT}: {@code String[]}, {@code null} marking a missing value</li>
 * <li>{@link ColumnType#CATEGORY}: a dictionary plus one code per row in a {@code byte[]},
 * {@code short[]} or {@code int[]} chosen by {@link MemoryFootprint#codeWidth(int)}, {@code -1}
 * marking a missing value</li>
 * </ul>
 *
 * <p>
 * Missing values of primitive columns are tracked in a {@link BitSet}, allocated only when the
 * column has at least one. {@link #getValue(int)} returns boxed values and decodes categories.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ChunkColumn {

    @Getter
    private final String name;

    @Getter
    private final ColumnType type;

    private final int size;

    // Primitive value array, String[] for text, code array for categorical columns
    private final Object data;

    // Missing rows of primitive columns; null when none
    private final BitSet missing;

    // Dictionary for categorical columns; empty otherwise
    private final List<String> categories;

    private ChunkColumn(String name, ColumnType type, int size, Object data, BitSet missing,
            List<String> categories) {
        Preconditions.checkNotNull(name, "name must not be null");
        this.name = name;
        this.type = type;
        this.size = size;
        this.data = data;
        this.missing = missing == null || missing.isEmpty() ? null : missing;
        this.categories = categories;
    }

    /**
     * Creates a {@link ColumnType#BOOLEAN} column.
     *
     * @param name column name
     * @param values row values; entries of missing rows are ignored
     * @param missing missing rows, may be {@code null}
     * @return new column owning both arguments
     */
    public static ChunkColumn ofBooleans(String name, boolean[] values, BitSet missing) {
        return new ChunkColumn(name, ColumnType.BOOLEAN, values.length, values, missing,
                Collections.emptyList());
    }

    /**
     * Creates a {@link ColumnType#INT64} column.
     *
     * @param name column name
     * @param values row values; entries of missing rows are ignored
     * @param missing missing rows, may be {@code null}
     * @return new column owning both arguments
     */
    public static ChunkColumn ofLongs(String name, long[] values, BitSet missing) {
        return new ChunkColumn(name, ColumnType.INT64, values.length, values, missing,
                Collections.emptyList());
    }

    /**
     * Creates a {@link ColumnType#FLOAT64} column.
     *
     * @param name column name
     * @param values row values; entries of missing rows are ignored
     * @param missing missing rows, may be {@code null}
     * @return new column owning both arguments
     */
    public static ChunkColumn ofDoubles(String name, double[] values, BitSet missing) {
        return new ChunkColumn(name, ColumnType.FLOAT64, values.length, values, missing,
                Collections.emptyList());
    }

    /**
     * Creates a {@link ColumnType#TEXT} column.
     *
     * @param name column name
     * @param values row values, {@code null} for missing
     * @return new column owning {@code values}
     */
    public static ChunkColumn ofStrings(String name, String[] values) {
        return new ChunkColumn(name, ColumnType.TEXT, values.length, values, null,
                Collections.emptyList());
    }

    /**
     * Creates a plain (non-categorical) column from boxed values.
     *
     * @param name column name
     * @param type storage type, anything but {@link ColumnType#CATEGORY}
     * @param values row values ({@link Boolean}, any {@link Number} or {@link String});
     *        {@code null} for missing
     * @return new column holding the values in the primitive layout of {@code type}
     */
    public static ChunkColumn of(String name, ColumnType type, Object[] values) {
        Preconditions.checkArgument(type != ColumnType.CATEGORY,
                "categorical columns are created with categorical()");
        int rows = values.length;
        if (type == ColumnType.TEXT) {
            String[] strings = new String[rows];
            for (int i = 0; i < rows; i++) {
                strings[i] = (String) values[i];
            }
            return ofStrings(name, strings);
        }
        BitSet missing = new BitSet();
        Object data = newArray(type, rows);
        for (int i = 0; i < rows; i++) {
            Object value = values[i];
            if (value == null) {
                missing.set(i);
            } else if (type == ColumnType.BOOLEAN) {
                ((boolean[]) data)[i] = (Boolean) value;
            } else if (type == ColumnType.FLOAT64) {
                ((double[]) data)[i] = ((Number) value).doubleValue();
            } else {
                store(data, i, ((Number) value).longValue());
            }
        }
        return new ChunkColumn(name, type, rows, data, missing, Collections.emptyList());
    }

    /**
     * Creates a dictionary-encoded column.
     *
     * @param name column name
     * @param categories distinct values, in first-seen order
     * @param codes per-row index into {@code categories}, {@code -1} for missing
     * @return new categorical column, its codes packed to the narrowest width
     */
    public static ChunkColumn categorical(String name, List<String> categories, int[] codes) {
        Object packed;
        switch (MemoryFootprint.codeWidth(categories.size())) {
            case 1:
                byte[] bytes = new byte[codes.length];
                for (int i = 0; i < codes.length; i++) {
                    bytes[i] = (byte) codes[i];
                }
                packed = bytes;
                break;
            case 2:
                short[] shorts = new short[codes.length];
                for (int i = 0; i < codes.length; i++) {
                    shorts[i] = (short) codes[i];
                }
                packed = shorts;
                break;
            default:
                packed = codes.clone();
        }
        return new ChunkColumn(name, ColumnType.CATEGORY, codes.length, packed, null,
                Collections.unmodifiableList(new ArrayList<>(categories)));
    }

    /**
     * Copies this integer column into the array layout of another integer width.
     *
     * @param target integer type holding every present value of this column
     * @return new column of type {@code target}
     * @throws IllegalStateException if this column or {@code target} is not an integer type
     */
    public ChunkColumn withIntegerType(ColumnType target) {
        Preconditions.checkState(type.isInteger() && target.isInteger(),
                "cannot convert %s column %s to %s", type, name, target);
        Object converted = newArray(target, size);
        for (int i = 0; i < size; i++) {
            if (!isMissing(i)) {
                store(converted, i, getLong(i));
            }
        }
        BitSet mask = missing == null ? null : (BitSet) missing.clone();
        return new ChunkColumn(name, target, size, converted, mask, Collections.emptyList());
    }

    /**
     * Returns the number of rows.
     *
     * @return row count
     */
    public int size() {
        return size;
    }

    /**
     * Returns whether a row's value is missing.
     *
     * @param row zero-based row index
     * @return {@code true} if missing
     */
    public boolean isMissing(int row) {
        Preconditions.checkElementIndex(row, size);
        if (type == ColumnType.TEXT) {
            return ((String[]) data)[row] == null;
        }
        if (type == ColumnType.CATEGORY) {
            return getCode(row) < 0;
        }
        return missing != null && missing.get(row);
    }

    /**
     * Returns the value of a row of an integer column without boxing.
     *
     * @param row zero-based row index, not missing
     * @return value widened to {@code long}
     * @throws IllegalStateException if this is not an integer column
     */
    public long getLong(int row) {
        Preconditions.checkElementIndex(row, size);
        switch (type) {
            case INT8:
                return ((byte[]) data)[row];
            case INT16:
                return ((short[]) data)[row];
            case INT32:
                return ((int[]) data)[row];
            case INT64:
                return ((long[]) data)[row];
            default:
                throw new IllegalStateException("column " + name + " is not an integer column");
        }
    }

    /**
     * Returns the logical value of a row, decoding categorical codes.
     *
     * @param row zero-based row index
     * @return boxed value, or {@code null} when missing
     */
    public Object getValue(int row) {
        if (isMissing(row)) {
            return null;
        }
        switch (type) {
            case BOOLEAN:
                return ((boolean[]) data)[row];
            case INT8:
                return ((byte[]) data)[row];
            case INT16:
                return ((short[]) data)[row];
            case INT32:
                return ((int[]) data)[row];
            case INT64:
                return ((long[]) data)[row];
            case FLOAT64:
                return ((double[]) data)[row];
            case CATEGORY:
                return categories.get(getCode(row));
            default:
                return ((String[]) data)[row];
        }
    }

    /**
     * Returns the dictionary of a categorical column.
     *
     * @return unmodifiable categories, empty for plain columns
     */
    public List<String> getCategories() {
        return categories;
    }

    /**
     * Returns the dictionary code of a row.
     *
     * @param row zero-based row index
     * @return code, {@code -1} for missing
     * @throws IllegalStateException if this column is not categorical
     */
    public int getCode(int row) {
        Preconditions.checkState(type == ColumnType.CATEGORY, "column %s is not categorical",
                name);
        if (data instanceof byte[]) {
            return ((byte[]) data)[row];
        }
        if (data instanceof short[]) {
            return ((short[]) data)[row];
        }
        return ((int[]) data)[row];
    }

    /**
     * Counts the rows whose value is missing.
     *
     * @return number of missing values
     */
    public long countMissing() {
        if (type.isTextual()) {
            long count = 0;
            for (int i = 0; i < size; i++) {
                if (isMissing(i)) {
                    count++;
                }
            }
            return count;
        }
        return missing == null ? 0 : missing.cardinality();
    }

    /**
     * Estimates the heap bytes held by this column's values.
     *
     * @return estimated bytes
     */
    public long estimateMemoryBytes() {
        return MemoryFootprint.of(this);
    }

    /**
     * Returns the bytes allocated for the missing-value mask.
     *
     * @return words of the mask in bytes, {@code 0} when no mask is held
     */
    long missingMaskBytes() {
        return missing == null ? 0 : missing.size() / Byte.SIZE;
    }

    /**
     * Returns the width of one categorical code as stored.
     *
     * @return {@code 1}, {@code 2} or {@code 4}
     */
    int storedCodeWidth() {
        if (data instanceof byte[]) {
            return 1;
        }
        return data instanceof short[] ? 2 : 4;
    }

    private static Object newArray(ColumnType type, int rows) {
        switch (type) {
            case BOOLEAN:
                return new boolean[rows];
            case INT8:
                return new byte[rows];
            case INT16:
                return new short[rows];
            case INT32:
                return new int[rows];
            case INT64:
                return new long[rows];
            case FLOAT64:
                return new double[rows];
            default:
                throw new IllegalStateException("No primitive layout for " + type);
        }
    }

    private static void store(Object array, int row, long value) {
        if (array instanceof byte[]) {
            ((byte[]) array)[row] = (byte) value;
        } else if (array instanceof short[]) {
            ((short[]) array)[row] = (short) value;
        } else if (array instanceof int[]) {
            ((int[]) array)[row] = (int) value;
        } else {
            ((long[]) array)[row] = value;
        }
    }

    @Override
    public String toString() {
        return name + ":" + type + "[" + size + "]";
    }
}
