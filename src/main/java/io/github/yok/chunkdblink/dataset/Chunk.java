package io.github.yok.chunkdblink.dataset;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * A bounded, contiguous slice of a dataset file's data rows, stored column-wise.
 *
 * <p>
 * All columns have the same length, and appear in the file's header order. A chunk is transient
 * working data: the reader creates it and the consumer drops it before pulling the next one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Chunk {

    // Zero-based index of this chunk's first row among the file's data rows
    @Getter
    private final long firstRow;

    @Getter
    private final int rowCount;

    private final List<ChunkColumn> columns;

    /**
     * Creates a chunk.
     *
     * @param firstRow zero-based index of the first row among the file's data rows
     * @param rowCount number of rows
     * @param columns columns in header order, each of length {@code rowCount}
     * @throws IllegalArgumentException if a column length differs from {@code rowCount}
     */
    public Chunk(long firstRow, int rowCount, List<ChunkColumn> columns) {
        for (ChunkColumn column : columns) {
            Preconditions.checkArgument(column.size() == rowCount,
                    "column %s has %s rows, expected %s", column.getName(), column.size(),
                    rowCount);
        }
        this.firstRow = firstRow;
        this.rowCount = rowCount;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    /**
     * Returns a chunk with the same rows and the given replacement columns.
     *
     * @param replacement columns in the same order and of the same length
     * @return new chunk
     */
    public Chunk withColumns(List<ChunkColumn> replacement) {
        Preconditions.checkArgument(replacement.size() == columns.size(),
                "column count changed from %s to %s", columns.size(), replacement.size());
        return new Chunk(firstRow, rowCount, replacement);
    }

    /**
     * Returns the columns in header order.
     *
     * @return unmodifiable column list
     */
    public List<ChunkColumn> getColumns() {
        return columns;
    }

    /**
     * Returns the column names in header order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(ChunkColumn::getName).collect(Collectors.toList());
    }

    /**
     * Returns the column at the given position.
     *
     * @param index zero-based column index
     * @return column
     */
    public ChunkColumn getColumn(int index) {
        return columns.get(index);
    }

    /**
     * Returns the column with the given name.
     *
     * @param name column name (exact match)
     * @return column
     * @throws IllegalArgumentException if no column has that name
     */
    public ChunkColumn getColumn(String name) {
        for (ChunkColumn column : columns) {
            if (column.getName().equals(name)) {
                return column;
            }
        }
        throw new IllegalArgumentException("No such column: " + name);
    }

    /**
     * Returns the storage type of each column.
     *
     * @return ordered mapping of column name to type
     */
    public Map<String, ColumnType> getColumnTypes() {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        columns.forEach(c -> types.put(c.getName(), c.getType()));
        return types;
    }

    /**
     * Returns one row as an ordered name-to-value mapping.
     *
     * @param row zero-based row index within this chunk
     * @return row values, {@code null} for missing
     */
    public Map<String, Object> getRow(int row) {
        Preconditions.checkElementIndex(row, rowCount);
        Map<String, Object> values = new LinkedHashMap<>();
        columns.forEach(c -> values.put(c.getName(), c.getValue(row)));
        return values;
    }

    /**
     * Estimates the heap bytes held by all columns.
     *
     * @return estimated bytes
     */
    public long estimateMemoryBytes() {
        return columns.stream().mapToLong(ChunkColumn::estimateMemoryBytes).sum();
    }

    @Override
    public String toString() {
        return "Chunk[firstRow=" + firstRow + ", rows=" + rowCount + ", columns=" + columns + "]";
    }
}
