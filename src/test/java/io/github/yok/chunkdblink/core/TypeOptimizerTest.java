package io.github.yok.chunkdblink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.chunkdblink.dataset.Chunk;
import io.github.yok.chunkdblink.dataset.ChunkColumn;
import io.github.yok.chunkdblink.dataset.ColumnType;
import java.util.List;
import org.junit.jupiter.api.Test;

class TypeOptimizerTest {

    private final TypeOptimizer optimizer = new TypeOptimizer();

    private static Chunk chunkOf(ChunkColumn... columns) {
        return new Chunk(0, columns[0].size(), List.of(columns));
    }

    private ColumnType narrowedType(long... values) {
        Object[] boxed = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        Chunk result = optimizer.optimize(chunkOf(ChunkColumn.of("n", ColumnType.INT64, boxed)));
        return result.getColumn(0).getType();
    }

    @Test
    void optimize_正常ケース_INT8の上限境界_127はINT8で128はINT16になること() {
        assertEquals(ColumnType.INT8, narrowedType(0, 127));
        assertEquals(ColumnType.INT16, narrowedType(0, 128));
    }

    @Test
    void optimize_正常ケース_INT8の下限境界_負の128はINT8で負の129はINT16になること() {
        assertEquals(ColumnType.INT8, narrowedType(-128, 0));
        assertEquals(ColumnType.INT16, narrowedType(-129, 0));
    }

    @Test
    void optimize_正常ケース_INT16の境界_32767はINT16で32768はINT32になること() {
        assertEquals(ColumnType.INT16, narrowedType(32767));
        assertEquals(ColumnType.INT32, narrowedType(32768));
        assertEquals(ColumnType.INT16, narrowedType(-32768));
        assertEquals(ColumnType.INT32, narrowedType(-32769));
    }

    @Test
    void optimize_正常ケース_INT32の境界_2147483647はINT32で2147483648はINT64のままであること() {
        assertEquals(ColumnType.INT32, narrowedType(2147483647L));
        assertEquals(ColumnType.INT64, narrowedType(2147483648L));
        assertEquals(ColumnType.INT32, narrowedType(-2147483648L));
        assertEquals(ColumnType.INT64, narrowedType(-2147483649L));
    }

    @Test
    void optimize_正常ケース_縮小後も論理値と欠損が保持されること() {
        ChunkColumn column = ChunkColumn.of("n", ColumnType.INT64, new Object[] {5L, null, -7L});
        ChunkColumn narrowed = optimizer.optimize(chunkOf(column)).getColumn(0);

        assertEquals(ColumnType.INT8, narrowed.getType());
        assertEquals(Byte.valueOf((byte) 5), narrowed.getValue(0));
        assertNull(narrowed.getValue(1));
        assertEquals(-7L, ((Number) narrowed.getValue(2)).longValue());
    }

    @Test
    void optimize_正常ケース_反復の多い文字列列_CATEGORYに変換されること() {
        ChunkColumn column = ChunkColumn.of("sector", ColumnType.TEXT,
                new Object[] {"Tech", "Energy", "Tech", null, "Tech", "Energy"});
        ChunkColumn result = optimizer.optimize(chunkOf(column)).getColumn(0);

        assertEquals(ColumnType.CATEGORY, result.getType());
        assertEquals(List.of("Tech", "Energy"), result.getCategories());
        assertEquals("Energy", result.getValue(5));
        assertNull(result.getValue(3));
        assertEquals(-1, result.getCode(3));
    }

    @Test
    void optimize_正常ケース_一意な値の多い文字列列_TEXTのままであること() {
        ChunkColumn column =
                ChunkColumn.of("name", ColumnType.TEXT, new Object[] {"a", "b", "c", "a"});
        assertEquals(ColumnType.TEXT, optimizer.optimize(chunkOf(column)).getColumn(0).getType());
    }

    @Test
    void optimize_正常ケース_比率がちょうど閾値_TEXTのままであること() {
        // 2 distinct / 4 rows = 0.5, not below 0.5
        ChunkColumn column =
                ChunkColumn.of("s", ColumnType.TEXT, new Object[] {"a", "b", "a", "b"});
        assertEquals(ColumnType.TEXT, optimizer.optimize(chunkOf(column)).getColumn(0).getType());
    }

    @Test
    void optimize_正常ケース_浮動小数と真偽値_変更されないこと() {
        ChunkColumn price = ChunkColumn.of("p", ColumnType.FLOAT64, new Object[] {1.0, 1.0});
        ChunkColumn flag = ChunkColumn.of("f", ColumnType.BOOLEAN, new Object[] {true, true});
        Chunk result = optimizer.optimize(chunkOf(price, flag));
        assertSame(price, result.getColumn(0));
        assertSame(flag, result.getColumn(1));
    }

    @Test
    void optimize_正常ケース_0行のチャンク_同じインスタンスが返ること() {
        Chunk empty = new Chunk(0, 0, List.of(ChunkColumn.of("a", ColumnType.TEXT, new Object[0])));
        assertSame(empty, optimizer.optimize(empty));
    }

    @Test
    void optimize_正常ケース_全て欠損の整数列_INT64のままであること() {
        ChunkColumn column = ChunkColumn.of("n", ColumnType.INT64, new Object[] {null, null});
        assertEquals(ColumnType.INT64, optimizer.optimize(chunkOf(column)).getColumn(0).getType());
    }

    @Test
    void constructor_異常ケース_範囲外の比率を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new TypeOptimizer(1.5));
        assertEquals(0.5, new TypeOptimizer().getCategoricalRatio());
    }
}
