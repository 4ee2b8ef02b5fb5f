package io.github.yok.chunkdblink.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChunkTest {

    private Chunk sample() {
        ChunkColumn id = ChunkColumn.of("id", ColumnType.INT64, new Object[] {1L, 2L, 3L});
        ChunkColumn sector =
                ChunkColumn.categorical("sector", List.of("Tech", "Energy"), new int[] {0, -1, 1});
        return new Chunk(100, 3, List.of(id, sector));
    }

    @Test
    void constructor_異常ケース_列の行数が一致しない_IllegalArgumentExceptionが送出されること() {
        ChunkColumn id = ChunkColumn.of("id", ColumnType.INT64, new Object[] {1L, 2L});
        assertThrows(IllegalArgumentException.class, () -> new Chunk(0, 3, List.of(id)));
    }

    @Test
    void getRow_正常ケース_カテゴリ列を含む_ヘッダ順にデコード済みの値が返ること() {
        Chunk chunk = sample();
        Map<String, Object> row = chunk.getRow(2);
        assertEquals(List.of("id", "sector"), List.copyOf(row.keySet()));
        assertEquals(3L, row.get("id"));
        assertEquals("Energy", row.get("sector"));
        assertNull(chunk.getRow(1).get("sector"));
    }

    @Test
    void getColumnTypes_正常ケース_列順の型マップが返ること() {
        Chunk chunk = sample();
        assertEquals(List.of(ColumnType.INT64, ColumnType.CATEGORY),
                List.copyOf(chunk.getColumnTypes().values()));
        assertEquals(100, chunk.getFirstRow());
        assertEquals(List.of("id", "sector"), chunk.getColumnNames());
    }

    @Test
    void getColumn_異常ケース_存在しない列名を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> sample().getColumn("missing"));
    }

    @Test
    void withColumns_異常ケース_列数が変わる_IllegalArgumentExceptionが送出されること() {
        Chunk chunk = sample();
        assertThrows(IllegalArgumentException.class,
                () -> chunk.withColumns(List.of(chunk.getColumn(0))));
    }

    @Test
    void of_異常ケース_CATEGORY型を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> ChunkColumn.of("c", ColumnType.CATEGORY, new Object[0]));
        assertThrows(IllegalStateException.class,
                () -> ChunkColumn.of("c", ColumnType.TEXT, new Object[] {"a"}).getCode(0));
    }

    @Test
    void withIntegerType_正常ケース_INT16へ変換する_値と欠損が保持されること() {
        ChunkColumn wide = ChunkColumn.of("n", ColumnType.INT64, new Object[] {300L, null, -2L});
        ChunkColumn narrow = wide.withIntegerType(ColumnType.INT16);

        assertEquals(ColumnType.INT16, narrow.getType());
        assertEquals(Short.valueOf((short) 300), narrow.getValue(0));
        assertTrue(narrow.isMissing(1));
        assertEquals(-2L, narrow.getLong(2));
        assertEquals(1, narrow.countMissing());
    }

    @Test
    void withIntegerType_異常ケース_浮動小数列を指定する_IllegalStateExceptionが送出されること() {
        ChunkColumn column = ChunkColumn.ofDoubles("d", new double[] {1.5}, null);
        assertThrows(IllegalStateException.class,
                () -> column.withIntegerType(ColumnType.INT8));
        assertThrows(IllegalStateException.class, () -> column.getLong(0));
    }

    @Test
    void categorical_正常ケース_小さな辞書_欠損符号が負の1で保持されること() {
        ChunkColumn column =
                ChunkColumn.categorical("s", List.of("a", "b"), new int[] {1, -1, 0});
        assertEquals(-1, column.getCode(1));
        assertTrue(column.isMissing(1));
        assertEquals("b", column.getValue(0));
        assertEquals(1, column.countMissing());
    }
}
