package io.github.yok.chunkdblink.core;

import io.github.yok.chunkdblink.exception.QueryExecutionException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Lazy sequence of result batches of at most {@code pageSize} rows each.
 *
 * <p>
 * Owns an open connection, statement, and cursor. Rows are pulled from the cursor only when the
 * next batch is requested, and everything is closed once the cursor is exhausted, on an error, or
 * by {@link #close()}. Concatenating the batches in order yields the same rows as an unpaged
 * query.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PagedQueryResult implements Iterator<ResultTable>, AutoCloseable {

    private final Connection connection;

    private final Statement statement;

    private final ResultSet resultSet;

    private final int pageSize;

    private final String sql;

    @Getter
    private final List<String> columnNames;

    // Batch read ahead by hasNext(), not yet returned
    private ResultTable pending;

    @Getter
    private long rowsRead;

    private boolean closed;

    PagedQueryResult(Connection connection, Statement statement, ResultSet resultSet,
            int pageSize, String sql) throws SQLException {
        this.connection = connection;
        this.statement = statement;
        this.resultSet = resultSet;
        this.pageSize = pageSize;
        this.sql = sql;
        this.columnNames = ResultTable.columnLabels(resultSet.getMetaData());
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !closed) {
            pending = fetchPage();
        }
        return pending != null;
    }

    @Override
    public ResultTable next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more result batches for: " + sql);
        }
        ResultTable batch = pending;
        pending = null;
        return batch;
    }

    /**
     * Reads up to {@code pageSize} rows from the cursor.
     *
     * @return batch, or {@code null} when the cursor is exhausted
     */
    private ResultTable fetchPage() {
        List<List<Object>> rows = new ArrayList<>(Math.min(pageSize, 1024));
        try {
            while (rows.size() < pageSize && resultSet.next()) {
                rows.add(ResultTable.readRow(resultSet, columnNames.size()));
            }
        } catch (SQLException e) {
            close();
            log.error("Failed to fetch query results: {}", e.getMessage(), e);
            throw new QueryExecutionException("Failed to fetch results for: " + sql, e);
        }
        if (rows.size() < pageSize) {
            close();
        }
        if (rows.isEmpty()) {
            return null;
        }
        rowsRead += rows.size();
        log.debug("Fetched batch of {} rows (total={})", rows.size(), rowsRead);
        return new ResultTable(columnNames, rows);
    }

    /**
     * Closes the cursor, statement, and connection. Batches already returned stay usable.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly(resultSet, statement, connection);
    }

    static void closeQuietly(AutoCloseable... resources) {
        for (AutoCloseable resource : resources) {
            if (resource == null) {
                continue;
            }
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(),
                        e.getMessage(), e);
            }
        }
    }
}
