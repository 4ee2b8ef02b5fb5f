package io.github.yok.chunkdblink.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MemoryFootprintTest {

    @Test
    void stringBytes_正常ケース_Latin1と非Latin1を指定する_文字幅が異なること() {
        assertEquals(0, MemoryFootprint.stringBytes(null));
        assertEquals(43, MemoryFootprint.stringBytes("abc"));
        assertEquals(44, MemoryFootprint.stringBytes("株式"));
    }

    @Test
    void codeWidth_正常ケース_辞書サイズに応じた幅が返ること() {
        assertEquals(1, MemoryFootprint.codeWidth(127));
        assertEquals(2, MemoryFootprint.codeWidth(128));
        assertEquals(4, MemoryFootprint.codeWidth(40000));
    }

    @Test
    void of_正常ケース_欠損のない固定長型_配列ヘッダと行数と幅の積であること() {
        Object[] values = new Object[10];
        for (int i = 0; i < values.length; i++) {
            values[i] = (long) i;
        }
        ChunkColumn int8 = ChunkColumn.of("a", ColumnType.INT8, values);
        ChunkColumn int64 = ChunkColumn.of("b", ColumnType.INT64, values);
        assertEquals(16 + 10, MemoryFootprint.of(int8));
        assertEquals(16 + 80, MemoryFootprint.of(int64));
    }

    @Test
    void of_正常ケース_欠損のある固定長型_欠損マスクの分が加算されること() {
        ChunkColumn column =
                ChunkColumn.of("a", ColumnType.INT32, new Object[] {1, null, 3, 4});
        // int[4] plus a BitSet holding one long word
        assertEquals(16 + 4 * 4 + 40 + 8, MemoryFootprint.of(column));
    }

    @Test
    void of_正常ケース_整数列を縮小する_見積りが幅に比例して小さくなること() {
        Object[] values = new Object[1000];
        for (int i = 0; i < values.length; i++) {
            values[i] = (long) (i % 100);
        }
        ChunkColumn wide = ChunkColumn.of("n", ColumnType.INT64, values);
        ChunkColumn narrow = wide.withIntegerType(ColumnType.INT8);

        assertEquals(16 + 8000, wide.estimateMemoryBytes());
        assertEquals(16 + 1000, narrow.estimateMemoryBytes());
    }

    @Test
    void of_正常ケース_反復の多い文字列列_カテゴリ化で見積りが小さくなること() {
        String[] raw = new String[100];
        int[] codes = new int[100];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = i % 2 == 0 ? "Technology" : "Energy";
            codes[i] = i % 2;
        }
        ChunkColumn text = ChunkColumn.ofStrings("sector", raw);
        ChunkColumn category =
                ChunkColumn.categorical("sector", List.of("Technology", "Energy"), codes);

        assertEquals(16 + 100 * 8 + 50 * 50 + 50 * 46, MemoryFootprint.of(text));
        // byte[100] codes plus the two-entry dictionary
        assertEquals(16 + 100 + 16 + (8 + 50) + (8 + 46), MemoryFootprint.of(category));
        assertTrue(category.estimateMemoryBytes() < text.estimateMemoryBytes());
    }

    @Test
    void of_正常ケース_大きな辞書_符号幅が2バイトで計上されること() {
        List<String> categories = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            categories.add("c" + i);
        }
        int[] codes = new int[400];
        for (int i = 0; i < codes.length; i++) {
            codes[i] = i % 200;
        }
        ChunkColumn category = ChunkColumn.categorical("c", categories, codes);
        long dictionary = 16;
        for (String c : categories) {
            dictionary += 8 + MemoryFootprint.stringBytes(c);
        }
        assertEquals(16 + 400 * 2 + dictionary, MemoryFootprint.of(category));
        assertEquals("c199", category.getValue(399));
    }
}
