package io.github.yok.chunkdblink.core;

import com.google.common.base.Preconditions;
import io.github.yok.chunkdblink.config.IngestConfig;
import io.github.yok.chunkdblink.dataset.Chunk;
import io.github.yok.chunkdblink.dataset.ChunkColumn;
import io.github.yok.chunkdblink.dataset.ColumnType;
import io.github.yok.chunkdblink.db.ChunkTable;
import io.github.yok.chunkdblink.db.StoreConnectionProvider;
import io.github.yok.chunkdblink.db.StoreDialect;
import io.github.yok.chunkdblink.exception.TableWriteException;
import io.github.yok.chunkdblink.parser.CsvChunkReader;
import io.github.yok.chunkdblink.parser.LoggingProgressListener;
import io.github.yok.chunkdblink.parser.ProgressListener;
import io.github.yok.chunkdblink.util.LogPathUtil;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.IDataSet;
import org.dbunit.operation.DatabaseOperation;

/**
 * Loads a CSV file into a relational table chunk by chunk.
 *
 * <p>
 * <strong>Write semantics:</strong>
 * </p>
 * <ul>
 * <li>The first chunk drops any existing table of the same name, creates it from the chunk's
 * columns, and inserts its rows.</li>
 * <li>Every later chunk is inserted into that table without duplicate checks. When a later chunk
 * holds values the table column cannot store (a decimal in an integer column, text in a numeric
 * column), the column is first widened with {@code ALTER TABLE}, so the loaded values do not
 * depend on the chunk size.</li>
 * <li>The table name is folded to the store's unquoted identifier case.</li>
 * <li>Each chunk is committed on its own. When a write fails, chunks committed before it stay in
 * the table; there is no rollback of earlier chunks and no resumption.</li>
 * </ul>
 *
 * <p>
 * Only one chunk is held at a time: chunk N+1 is not read before chunk N has been narrowed by the
 * {@link TypeOptimizer}, written, and dropped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ChunkedTableLoader {

    /**
     * Abstraction for the DBUnit write operation used by this loader.
     */
    interface OperationExecutor {

        /**
         * Executes DBUnit INSERT.
         *
         * @param connection DBUnit connection
         * @param dataSet dataset to write
         * @throws Exception execution failure
         */
        void insert(IDatabaseConnection connection, IDataSet dataSet) throws Exception;
    }

    // Store handle; one connection is acquired per load
    private final StoreConnectionProvider connectionProvider;

    // Default chunk size, CSV format and SQL type policy
    private final IngestConfig ingestConfig;

    private final TypeOptimizer optimizer;

    // DBUnit operation executor (replaceable in tests)
    private final OperationExecutor operationExecutor;

    /**
     * Creates a loader writing with DBUnit {@link DatabaseOperation#INSERT}.
     *
     * @param connectionProvider store handle
     * @param ingestConfig ingestion settings
     */
    public ChunkedTableLoader(StoreConnectionProvider connectionProvider,
            IngestConfig ingestConfig) {
        this(connectionProvider, ingestConfig, DatabaseOperation.INSERT::execute);
    }

    /**
     * Creates a loader with a custom write operation.
     *
     * @param connectionProvider store handle
     * @param ingestConfig ingestion settings
     * @param operationExecutor executor for chunk inserts
     */
    ChunkedTableLoader(StoreConnectionProvider connectionProvider, IngestConfig ingestConfig,
            OperationExecutor operationExecutor) {
        this.connectionProvider = connectionProvider;
        this.ingestConfig = ingestConfig;
        this.optimizer = new TypeOptimizer(ingestConfig.getCategoricalRatio());
        this.operationExecutor = operationExecutor;
    }

    /**
     * Loads {@code path} into {@code tableName} with the configured chunk size.
     *
     * @param path dataset file
     * @param tableName target table
     * @return total rows written
     * @see #load(Path, String, int)
     */
    public long load(Path path, String tableName) {
        return load(path, tableName, ingestConfig.getChunkSize());
    }

    /**
     * Loads {@code path} into {@code tableName}, replacing the table's previous contents.
     *
     * <p>
     * A file with a header but no data rows leaves an empty table with one text column per header
     * name.
     * </p>
     *
     * @param path dataset file
     * @param tableName target table
     * @param chunkSize data rows per chunk, positive
     * @return total rows written, equal to the file's data-row count on success
     * @throws io.github.yok.chunkdblink.exception.DatasetReadException if the file cannot be read
     * @throws io.github.yok.chunkdblink.exception.DatasetFormatException if a row is malformed
     * @throws TableWriteException if the store rejects a chunk; earlier chunks stay committed
     */
    public long load(Path path, String tableName, int chunkSize) {
        Preconditions.checkArgument(StringUtils.isNotBlank(tableName),
                "tableName must not be blank");
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive: %s", chunkSize);
        log.info("=== Load started (file={}, table={}, chunkSize={}) ===",
                LogPathUtil.renderPathForLog(path), tableName, chunkSize);

        ProgressListener progress = new LoggingProgressListener(path);
        long totalRows = 0;
        try (Connection jdbc = acquire(tableName);
                CsvChunkReader reader =
                        CsvChunkReader.open(path, chunkSize, ingestConfig, progress)) {
            String table = foldTableName(jdbc, tableName);
            ColumnType[] schema = null;
            IDatabaseConnection dbConn = null;
            int chunkNo = 0;
            while (reader.hasNext()) {
                Chunk chunk = optimizer.optimize(reader.next());
                chunkNo++;
                if (schema == null) {
                    replaceTable(jdbc, table, chunk);
                    schema = storedTypes(chunk);
                    dbConn = openDbUnitConnection(jdbc, table);
                } else if (widenColumns(jdbc, table, schema, chunk)) {
                    // DBUnit caches column metadata per connection
                    dbConn = openDbUnitConnection(jdbc, table);
                }
                writeChunk(jdbc, dbConn, table, chunk, chunkNo);
                totalRows += chunk.getRowCount();
                log.info("Table[{}] chunk {} | inserted={}, total={}", table, chunkNo,
                        chunk.getRowCount(), totalRows);
            }
            if (chunkNo == 0) {
                log.info("Table[{}] {} has no data rows; creating empty table", table, path);
                replaceTable(jdbc, table, emptyChunk(reader.getHeader()));
            }
        } catch (SQLException e) {
            // Raised by closing the connection
            log.error("Table[{}] Failed to release store connection: {}", tableName,
                    e.getMessage(), e);
            throw new TableWriteException("Failed to release store connection", e);
        }

        log.info("Successfully saved {} rows to table: {}", totalRows, tableName);
        return totalRows;
    }

    private Connection acquire(String tableName) {
        try {
            Connection jdbc = connectionProvider.acquire();
            jdbc.setAutoCommit(false);
            return jdbc;
        } catch (SQLException e) {
            log.error("Table[{}] Failed to connect to store: {}", tableName, e.getMessage(), e);
            throw new TableWriteException("Failed to connect to store for table " + tableName, e);
        }
    }

    private String foldTableName(Connection jdbc, String tableName) {
        try {
            String folded = StoreDialect.foldIdentifier(tableName, jdbc.getMetaData());
            if (!folded.equals(tableName)) {
                log.info("Table[{}] stored as {}", tableName, folded);
            }
            return folded;
        } catch (SQLException e) {
            log.error("Table[{}] Failed to read store metadata: {}", tableName, e.getMessage(), e);
            throw new TableWriteException("Failed to read store metadata for table " + tableName,
                    e);
        }
    }

    /**
     * Drops and re-creates the table from the chunk's columns, then commits.
     *
     * @param jdbc connection in manual-commit mode
     * @param tableName target table
     * @param chunk chunk defining the schema
     */
    private void replaceTable(Connection jdbc, String tableName, Chunk chunk) {
        StoreDialect dialect = connectionProvider.getDialect();
        String create =
                dialect.createTableSql(tableName, chunk, ingestConfig.isWidenTableColumns());
        try (Statement st = jdbc.createStatement()) {
            st.executeUpdate(dialect.dropTableSql(tableName));
            st.executeUpdate(create);
            jdbc.commit();
            log.info("Table[{}] replaced: {}", tableName, create);
        } catch (SQLException e) {
            rollback(jdbc, tableName);
            log.error("Table[{}] Failed to replace table: {}", tableName, e.getMessage(), e);
            throw new TableWriteException("Failed to replace table " + tableName, e);
        }
    }

    /**
     * Returns the type each table column was created for.
     *
     * @param chunk first chunk
     * @return per-column types in header order, {@code null} for a column holding no value yet
     */
    private ColumnType[] storedTypes(Chunk chunk) {
        ColumnType[] types = new ColumnType[chunk.getColumns().size()];
        for (int c = 0; c < types.length; c++) {
            ChunkColumn column = chunk.getColumn(c);
            types[c] = holdsValues(column) ? storedType(column.getType()) : null;
        }
        return types;
    }

    private ColumnType storedType(ColumnType type) {
        if (ingestConfig.isWidenTableColumns() && type.isInteger()) {
            return ColumnType.INT64;
        }
        return type == ColumnType.CATEGORY ? ColumnType.TEXT : type;
    }

    private static boolean holdsValues(ChunkColumn column) {
        return column.countMissing() < column.size();
    }

    /**
     * Alters the table columns that cannot hold the chunk's values, then commits.
     *
     * <p>
     * A column widens to the common type of its current type and the chunk's
     * ({@link ColumnType#widen(ColumnType)}). A column that has held only missing values so far
     * takes the chunk's type.
     * </p>
     *
     * @param jdbc connection in manual-commit mode
     * @param tableName target table
     * @param schema current column types, updated in place
     * @param chunk chunk about to be written
     * @return {@code true} if any column was altered
     */
    private boolean widenColumns(Connection jdbc, String tableName, ColumnType[] schema,
            Chunk chunk) {
        StoreDialect dialect = connectionProvider.getDialect();
        List<String> statements = new ArrayList<>();
        for (int c = 0; c < schema.length; c++) {
            ChunkColumn column = chunk.getColumn(c);
            if (!holdsValues(column)) {
                continue;
            }
            ColumnType incoming = storedType(column.getType());
            ColumnType widened = schema[c] == null ? incoming : schema[c].widen(incoming);
            if (widened == schema[c]) {
                continue;
            }
            log.info("Table[{}] column {} changed from {} to {} at row {}", tableName,
                    column.getName(), schema[c], widened, chunk.getFirstRow() + 1);
            statements.add(dialect.alterColumnTypeSql(tableName, column.getName(),
                    dialect.sqlType(widened, ingestConfig.isWidenTableColumns())));
            schema[c] = widened;
        }
        if (statements.isEmpty()) {
            return false;
        }
        try (Statement st = jdbc.createStatement()) {
            for (String sql : statements) {
                st.executeUpdate(sql);
            }
            jdbc.commit();
            return true;
        } catch (SQLException e) {
            rollback(jdbc, tableName);
            log.error("Table[{}] Failed to widen columns: {}", tableName, e.getMessage(), e);
            throw new TableWriteException("Failed to widen columns of table " + tableName, e);
        }
    }

    private IDatabaseConnection openDbUnitConnection(Connection jdbc, String tableName) {
        try {
            return connectionProvider.openDbUnitConnection(jdbc);
        } catch (Exception e) {
            log.error("Table[{}] Failed to initialize DBUnit connection: {}", tableName,
                    e.getMessage(), e);
            throw new TableWriteException("Failed to initialize DBUnit connection", e);
        }
    }

    /**
     * Inserts one chunk and commits it.
     *
     * @param jdbc connection in manual-commit mode
     * @param dbConn DBUnit connection over {@code jdbc}
     * @param tableName target table
     * @param chunk chunk to write
     * @param chunkNo one-based chunk number, for messages
     */
    private void writeChunk(Connection jdbc, IDatabaseConnection dbConn, String tableName,
            Chunk chunk, int chunkNo) {
        try {
            operationExecutor.insert(dbConn, new DefaultDataSet(new ChunkTable(tableName, chunk)));
            jdbc.commit();
        } catch (Exception e) {
            rollback(jdbc, tableName);
            String msg = String.format("Failed to write chunk %d (rows %d-%d) to table %s", chunkNo,
                    chunk.getFirstRow() + 1, chunk.getFirstRow() + chunk.getRowCount(), tableName);
            log.error("{}: {}", msg, e.getMessage(), e);
            throw new TableWriteException(msg, e);
        }
    }

    private void rollback(Connection jdbc, String tableName) {
        try {
            jdbc.rollback();
            log.warn("Table[{}] Uncommitted statements rolled back; earlier chunks are kept.",
                    tableName);
        } catch (SQLException rollbackEx) {
            log.warn("Table[{}] Rollback failed: {}", tableName, rollbackEx.getMessage(),
                    rollbackEx);
        }
    }

    private static Chunk emptyChunk(List<String> header) {
        List<ChunkColumn> columns = header.stream()
                .map(name -> ChunkColumn.of(name, ColumnType.TEXT, new Object[0]))
                .collect(Collectors.toList());
        return new Chunk(0, 0, columns);
    }
}
