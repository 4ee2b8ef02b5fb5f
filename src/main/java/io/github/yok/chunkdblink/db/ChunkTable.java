package io.github.yok.chunkdblink.db;

import io.github.yok.chunkdblink.dataset.Chunk;
import io.github.yok.chunkdblink.dataset.ChunkColumn;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.ITableMetaData;
import org.dbunit.dataset.RowOutOfBoundsException;
import org.dbunit.dataset.datatype.DataType;

/**
 * Read-only {@link ITable} view of a {@link Chunk}, so that DBUnit operations can write it.
 *
 * <p>
 * Categorical columns are exposed with their decoded string values; narrowed integers keep their
 * boxed width and are converted by DBUnit according to the target column's type.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ChunkTable implements ITable {

    private final Chunk chunk;

    private final ITableMetaData metaData;

    /**
     * Constructor.
     *
     * @param tableName target table name
     * @param chunk chunk to expose
     */
    public ChunkTable(String tableName, Chunk chunk) {
        this.chunk = chunk;
        Column[] columns = chunk.getColumns().stream()
                .map(c -> new Column(c.getName(), dataTypeOf(c))).toArray(Column[]::new);
        this.metaData = new DefaultTableMetaData(tableName, columns);
    }

    @Override
    public ITableMetaData getTableMetaData() {
        return metaData;
    }

    @Override
    public int getRowCount() {
        return chunk.getRowCount();
    }

    /**
     * Returns the logical value of a cell.
     *
     * @param row zero-based row index
     * @param columnName column name, matched case-insensitively
     * @return value, {@code null} when missing
     * @throws DataSetException if the row or column does not exist
     */
    @Override
    public Object getValue(int row, String columnName) throws DataSetException {
        if (row < 0 || row >= chunk.getRowCount()) {
            throw new RowOutOfBoundsException(row + " > " + (chunk.getRowCount() - 1));
        }
        int index = metaData.getColumnIndex(columnName);
        return chunk.getColumn(index).getValue(row);
    }

    /**
     * Maps a chunk column's storage type to the DBUnit data type used to bind it.
     *
     * @param column chunk column
     * @return DBUnit data type
     */
    static DataType dataTypeOf(ChunkColumn column) {
        switch (column.getType()) {
            case BOOLEAN:
                return DataType.BOOLEAN;
            case INT8:
                return DataType.TINYINT;
            case INT16:
                return DataType.SMALLINT;
            case INT32:
                return DataType.INTEGER;
            case INT64:
                return DataType.BIGINT;
            case FLOAT64:
                return DataType.DOUBLE;
            default:
                return DataType.VARCHAR;
        }
    }
}
