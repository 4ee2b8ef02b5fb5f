package io.github.yok.chunkdblink.core;

import com.google.common.base.Preconditions;
import io.github.yok.chunkdblink.db.StoreConnectionProvider;
import io.github.yok.chunkdblink.exception.QueryExecutionException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs SQL queries against the store, either fully materialized or as a lazy sequence of batches.
 *
 * <p>
 * The SQL text is passed to the store unchanged; callers are trusted. Each call acquires its own
 * connection from the {@link StoreConnectionProvider}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class QueryExecutor {

    private final StoreConnectionProvider connectionProvider;

    /**
     * Runs a query and returns its complete result.
     *
     * @param sql query text
     * @return every row of the result
     * @throws QueryExecutionException if the store rejects the query or the connection fails
     */
    public ResultTable query(String sql) {
        log.info("Executing query: {}", sql);
        try (Connection jdbc = connectionProvider.acquire();
                Statement st = jdbc.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            List<String> columns = ResultTable.columnLabels(rs.getMetaData());
            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(ResultTable.readRow(rs, columns.size()));
            }
            log.info("Query returned {} rows", rows.size());
            return new ResultTable(columns, rows);
        } catch (SQLException e) {
            log.error("Query failed: {} | {}", sql, e.getMessage(), e);
            throw new QueryExecutionException("Query failed: " + sql, e);
        }
    }

    /**
     * Runs a query and returns its rows in batches of at most {@code pageSize}.
     *
     * <p>
     * The query executes immediately; rows are fetched as the returned sequence is advanced. The
     * caller should close the result when it stops iterating early.
     * </p>
     *
     * @param sql query text
     * @param pageSize maximum rows per batch, positive
     * @return open paged result
     * @throws QueryExecutionException if the store rejects the query or the connection fails
     */
    public PagedQueryResult query(String sql, int pageSize) {
        Preconditions.checkArgument(pageSize > 0, "pageSize must be positive: %s", pageSize);
        log.info("Executing query in batches of {}: {}", pageSize, sql);
        Connection jdbc = null;
        Statement st = null;
        ResultSet rs = null;
        try {
            jdbc = connectionProvider.acquire();
            // Cursor-based fetching requires an open transaction on some drivers
            jdbc.setAutoCommit(false);
            st = jdbc.createStatement(ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
            st.setFetchSize(pageSize);
            rs = st.executeQuery(sql);
            return new PagedQueryResult(jdbc, st, rs, pageSize, sql);
        } catch (SQLException e) {
            PagedQueryResult.closeQuietly(rs, st, jdbc);
            log.error("Query failed: {} | {}", sql, e.getMessage(), e);
            throw new QueryExecutionException("Query failed: " + sql, e);
        }
    }
}
