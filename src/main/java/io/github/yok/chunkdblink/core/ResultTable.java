package io.github.yok.chunkdblink.core;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Tabular query result held in memory: column labels plus rows of JDBC values.
 *
 * <p>
 * Values are whatever {@link ResultSet#getObject(int)} returns for the column, {@code null} for SQL
 * {@code NULL}. Column order follows the select list.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public class ResultTable {

    private final List<String> columnNames;

    private final List<List<Object>> rows;

    /**
     * Creates a result.
     *
     * @param columnNames column labels in select-list order
     * @param rows rows, each of {@code columnNames.size()} values
     */
    public ResultTable(List<String> columnNames, List<List<Object>> rows) {
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * Returns one value by row index and column label.
     *
     * @param row zero-based row index
     * @param columnName column label, case-sensitive
     * @return value, may be {@code null}
     * @throws IllegalArgumentException if no such column exists
     */
    public Object getValue(int row, String columnName) {
        int index = columnNames.indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("No such column: " + columnName);
        }
        return rows.get(row).get(index);
    }

    /**
     * Converts every row into a map keyed by column label, preserving column order.
     *
     * @return rows as ordered maps
     */
    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> maps = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int c = 0; c < columnNames.size(); c++) {
                map.put(columnNames.get(c), row.get(c));
            }
            maps.add(map);
        }
        return maps;
    }

    /**
     * Reads the column labels of a result set.
     *
     * @param md result set metadata
     * @return labels in select-list order
     * @throws SQLException if metadata cannot be read
     */
    static List<String> columnLabels(ResultSetMetaData md) throws SQLException {
        List<String> labels = new ArrayList<>(md.getColumnCount());
        for (int i = 1; i <= md.getColumnCount(); i++) {
            labels.add(md.getColumnLabel(i));
        }
        return labels;
    }

    /**
     * Reads the current row of a result set.
     *
     * @param rs result set positioned on a row
     * @param columnCount number of columns
     * @return row values
     * @throws SQLException if a value cannot be read
     */
    static List<Object> readRow(ResultSet rs, int columnCount) throws SQLException {
        List<Object> row = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            row.add(rs.getObject(i));
        }
        return row;
    }
}
