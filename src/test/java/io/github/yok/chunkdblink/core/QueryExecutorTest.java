package io.github.yok.chunkdblink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.chunkdblink.config.ConnectionConfig;
import io.github.yok.chunkdblink.db.DbUnitConfigFactory;
import io.github.yok.chunkdblink.db.StoreConnectionProvider;
import io.github.yok.chunkdblink.exception.QueryExecutionException;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryExecutorTest {

    private StoreConnectionProvider provider;

    private QueryExecutor executor;

    @BeforeEach
    void setup() throws Exception {
        ConnectionConfig connectionConfig = new ConnectionConfig();
        connectionConfig.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        provider = new StoreConnectionProvider(connectionConfig, new DbUnitConfigFactory());
        executor = new QueryExecutor(provider);

        try (Connection conn = provider.acquire(); Statement st = conn.createStatement()) {
            st.executeUpdate("CREATE TABLE PRICES (ID BIGINT, SYMBOL VARCHAR, CLOSE DOUBLE)");
            for (int i = 1; i <= 10; i++) {
                st.executeUpdate("INSERT INTO PRICES VALUES (" + i + ", 'S" + i + "', "
                        + (i % 4 == 0 ? "NULL" : String.valueOf(i * 1.5)) + ")");
            }
        }
    }

    private List<List<Object>> concatenate(PagedQueryResult paged, List<Integer> batchSizes) {
        List<List<Object>> rows = new ArrayList<>();
        while (paged.hasNext()) {
            ResultTable batch = paged.next();
            batchSizes.add(batch.getRowCount());
            rows.addAll(batch.getRows());
        }
        return rows;
    }

    @Test
    void query_正常ケース_全件取得_列名と全行が返ること() {
        ResultTable result = executor.query("SELECT ID, SYMBOL, CLOSE FROM PRICES ORDER BY ID");

        assertEquals(List.of("ID", "SYMBOL", "CLOSE"), result.getColumnNames());
        assertEquals(10, result.getRowCount());
        assertEquals("S3", result.getValue(2, "SYMBOL"));
        assertNull(result.getValue(3, "CLOSE"));
    }

    @Test
    void query_正常ケース_集計クエリ_1行が返ること() {
        ResultTable result = executor.query("SELECT COUNT(*) AS CNT FROM PRICES");
        assertEquals(10L, ((Number) result.getValue(0, "CNT")).longValue());
    }

    @Test
    void query_正常ケース_ページ分割_連結結果が全件取得と一致すること() {
        String sql = "SELECT * FROM PRICES ORDER BY ID";
        List<Integer> batchSizes = new ArrayList<>();

        List<List<Object>> paged;
        try (PagedQueryResult result = executor.query(sql, 3)) {
            paged = concatenate(result, batchSizes);
            assertEquals(10, result.getRowsRead());
        }

        assertEquals(List.of(3, 3, 3, 1), batchSizes);
        assertEquals(executor.query(sql).getRows(), paged);
    }

    @Test
    void query_正常ケース_行数がページサイズで割り切れる_空のバッチが返らないこと() {
        List<Integer> batchSizes = new ArrayList<>();
        try (PagedQueryResult result = executor.query("SELECT * FROM PRICES", 5)) {
            concatenate(result, batchSizes);
            assertThrows(NoSuchElementException.class, result::next);
        }
        assertEquals(List.of(5, 5), batchSizes);
    }

    @Test
    void query_正常ケース_該当行なし_全件取得は0行でページ分割はバッチなしであること() {
        String sql = "SELECT * FROM PRICES WHERE ID < 0";

        ResultTable full = executor.query(sql);
        assertEquals(0, full.getRowCount());
        assertEquals(3, full.getColumnNames().size());

        try (PagedQueryResult paged = executor.query(sql, 4)) {
            assertFalse(paged.hasNext());
            assertEquals(List.of("ID", "SYMBOL", "CLOSE"), paged.getColumnNames());
        }
    }

    @Test
    void query_異常ケース_不正なSQL_QueryExecutionExceptionが送出されること() {
        assertThrows(QueryExecutionException.class, () -> executor.query("SELEKT * FROM PRICES"));
        assertThrows(QueryExecutionException.class,
                () -> executor.query("SELECT * FROM NO_SUCH_TABLE", 10));
    }

    @Test
    void query_異常ケース_ページサイズ0_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> executor.query("SELECT 1", 0));
    }

    @Test
    void toMaps_正常ケース_列順を保持した行マップが返ること() {
        List<Map<String, Object>> maps =
                executor.query("SELECT SYMBOL, ID FROM PRICES WHERE ID = 2").toMaps();

        assertEquals(1, maps.size());
        assertEquals(List.of("SYMBOL", "ID"), List.copyOf(maps.get(0).keySet()));
        assertEquals("S2", maps.get(0).get("SYMBOL"));
    }

    @Test
    void getValue_異常ケース_存在しない列名_IllegalArgumentExceptionが送出されること() {
        ResultTable result = executor.query("SELECT ID FROM PRICES");
        assertThrows(IllegalArgumentException.class, () -> result.getValue(0, "NOPE"));
    }
}
