package io.github.yok.chunkdblink.core;

import com.google.common.base.Preconditions;
import io.github.yok.chunkdblink.dataset.Chunk;
import io.github.yok.chunkdblink.dataset.ChunkColumn;
import io.github.yok.chunkdblink.dataset.ColumnType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Narrows the storage types of a chunk's columns to reduce its memory footprint.
 *
 * <p>
 * Each column is decided independently, from the values of the given chunk only:
 * </p>
 * <ul>
 * <li>{@link ColumnType#TEXT}: converted to {@link ColumnType#CATEGORY} when
 * {@code distinct / rows} is below the categorical ratio;</li>
 * <li>{@link ColumnType#INT64}: narrowed to the smallest of {@link ColumnType#INT8},
 * {@link ColumnType#INT16}, {@link ColumnType#INT32} holding both the minimum and maximum, and
 * copied into a {@code byte[]}, {@code short[]} or {@code int[]};</li>
 * <li>other columns are returned as-is.</li>
 * </ul>
 *
 * <p>
 * Logical values never change. Two chunks of the same file may end up with different types for the
 * same column.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TypeOptimizer {

    // Candidate widths, narrowest first
    private static final ColumnType[] INTEGER_WIDTHS =
            {ColumnType.INT8, ColumnType.INT16, ColumnType.INT32};

    /**
     * Text columns whose distinct/rows ratio is strictly below this value become categorical.
     */
    @Getter
    private final double categoricalRatio;

    /**
     * Creates an optimizer with the default categorical ratio of {@code 0.5}.
     */
    public TypeOptimizer() {
        this(0.5);
    }

    /**
     * Creates an optimizer.
     *
     * @param categoricalRatio distinct/rows ratio below which text becomes categorical
     */
    public TypeOptimizer(double categoricalRatio) {
        Preconditions.checkArgument(categoricalRatio >= 0 && categoricalRatio <= 1,
                "categoricalRatio must be within [0, 1]: %s", categoricalRatio);
        this.categoricalRatio = categoricalRatio;
    }

    /**
     * Returns a chunk with the same values and possibly narrower column types.
     *
     * @param chunk chunk to optimize; not modified
     * @return optimized chunk, or {@code chunk} itself when it has no rows
     */
    public Chunk optimize(Chunk chunk) {
        if (chunk.getRowCount() == 0) {
            return chunk;
        }
        List<ChunkColumn> optimized = new ArrayList<>(chunk.getColumns().size());
        for (ChunkColumn column : chunk.getColumns()) {
            ChunkColumn result = optimizeColumn(column, chunk.getRowCount());
            if (result.getType() != column.getType()) {
                log.debug("Column[{}] rows {}+{}: {} -> {}", column.getName(), chunk.getFirstRow(),
                        chunk.getRowCount(), column.getType(), result.getType());
            }
            optimized.add(result);
        }
        return chunk.withColumns(optimized);
    }

    private ChunkColumn optimizeColumn(ChunkColumn column, int rowCount) {
        if (column.getType() == ColumnType.TEXT) {
            return toCategoricalIfRepetitive(column, rowCount);
        }
        if (column.getType() == ColumnType.INT64) {
            return narrowInteger(column);
        }
        return column;
    }

    /**
     * Dictionary-encodes a text column when few of its values are distinct.
     *
     * @param column text column
     * @param rowCount rows in the chunk
     * @return categorical column, or {@code column} unchanged
     */
    ChunkColumn toCategoricalIfRepetitive(ChunkColumn column, int rowCount) {
        Map<String, Integer> dictionary = new HashMap<>();
        List<String> categories = new ArrayList<>();
        int[] codes = new int[rowCount];
        for (int i = 0; i < rowCount; i++) {
            String value = (String) column.getValue(i);
            if (value == null) {
                codes[i] = -1;
                continue;
            }
            Integer code = dictionary.get(value);
            if (code == null) {
                code = categories.size();
                dictionary.put(value, code);
                categories.add(value);
            }
            codes[i] = code;
        }
        double ratio = (double) categories.size() / rowCount;
        if (ratio >= categoricalRatio) {
            return column;
        }
        return ChunkColumn.categorical(column.getName(), categories, codes);
    }

    /**
     * Narrows a 64-bit integer column to the smallest width holding all of its values.
     *
     * @param column {@link ColumnType#INT64} column
     * @return narrowed column, or {@code column} unchanged
     */
    ChunkColumn narrowInteger(ChunkColumn column) {
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        boolean anyPresent = false;
        for (int i = 0; i < column.size(); i++) {
            if (column.isMissing(i)) {
                continue;
            }
            long v = column.getLong(i);
            min = Math.min(min, v);
            max = Math.max(max, v);
            anyPresent = true;
        }
        if (!anyPresent) {
            return column;
        }
        for (ColumnType target : INTEGER_WIDTHS) {
            if (target.fits(min, max)) {
                return column.withIntegerType(target);
            }
        }
        return column;
    }
}
