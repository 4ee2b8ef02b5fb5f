package io.github.yok.chunkdblink.dataset;

import java.util.BitSet;
import java.util.Collection;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds typed {@link ChunkColumn}s from raw CSV cells.
 *
 * <p>
 * The type of a column is decided from the cells given to {@link #build(String, String[])} only:
 * </p>
 * <ul>
 * <li>cells equal to one of the configured NA tokens (or empty) are missing: {@code null} in text
 * columns, a bit in the missing-value mask otherwise;</li>
 * <li>every present cell is {@code true}/{@code false} (any case) → {@link ColumnType#BOOLEAN};</li>
 * <li>every present cell is a 64-bit integer → {@link ColumnType#INT64};</li>
 * <li>every present cell is an integer or a decimal → {@link ColumnType#FLOAT64};</li>
 * <li>otherwise, or when no cell is present → {@link ColumnType#TEXT}.</li>
 * </ul>
 *
 * <p>
 * Integer literals outside the 64-bit range make the column {@link ColumnType#TEXT} so that no
 * digits are lost.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ColumnTypeInference {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    // Requires a fraction or an exponent; plain digit strings are integers
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+(\\.\\d*)?[eE][+-]?\\d+|\\.\\d+[eE][+-]?\\d+)");

    private enum CellKind {
        BOOLEAN, INTEGER, DECIMAL, OTHER
    }

    // Tokens treated as missing values, compared after trimming
    private final Set<String> naValues;

    /**
     * Creates an inference using the given NA tokens.
     *
     * @param naValues tokens treated as missing (the empty string is always missing)
     */
    public ColumnTypeInference(Collection<String> naValues) {
        this.naValues = Set.copyOf(naValues);
    }

    /**
     * Returns whether a raw cell is a missing value.
     *
     * @param cell raw cell, may be {@code null}
     * @return {@code true} if missing
     */
    public boolean isMissing(String cell) {
        if (cell == null) {
            return true;
        }
        String trimmed = cell.trim();
        return trimmed.isEmpty() || naValues.contains(trimmed);
    }

    /**
     * Infers the column type from the cells and converts them.
     *
     * @param name column name
     * @param cells raw cells of every row, in row order
     * @return typed column of {@code cells.length} rows
     */
    public ChunkColumn build(String name, String[] cells) {
        ColumnType type = inferType(cells);
        log.debug("Column[{}] inferred as {} from {} cells", name, type, cells.length);
        int rows = cells.length;
        BitSet missing = new BitSet();
        switch (type) {
            case BOOLEAN:
                boolean[] flags = new boolean[rows];
                for (int i = 0; i < rows; i++) {
                    if (isMissing(cells[i])) {
                        missing.set(i);
                    } else {
                        flags[i] = Boolean.parseBoolean(cells[i].trim());
                    }
                }
                return ChunkColumn.ofBooleans(name, flags, missing);
            case INT64:
                long[] longs = new long[rows];
                for (int i = 0; i < rows; i++) {
                    if (isMissing(cells[i])) {
                        missing.set(i);
                    } else {
                        longs[i] = Long.parseLong(cells[i].trim());
                    }
                }
                return ChunkColumn.ofLongs(name, longs, missing);
            case FLOAT64:
                double[] doubles = new double[rows];
                for (int i = 0; i < rows; i++) {
                    if (isMissing(cells[i])) {
                        missing.set(i);
                    } else {
                        doubles[i] = Double.parseDouble(cells[i].trim());
                    }
                }
                return ChunkColumn.ofDoubles(name, doubles, missing);
            default:
                String[] text = new String[rows];
                for (int i = 0; i < rows; i++) {
                    text[i] = isMissing(cells[i]) ? null : cells[i];
                }
                return ChunkColumn.ofStrings(name, text);
        }
    }

    /**
     * Infers the narrowest parsed type that holds every present cell.
     *
     * @param cells raw cells
     * @return inferred type
     */
    ColumnType inferType(String[] cells) {
        boolean anyPresent = false;
        boolean allBoolean = true;
        boolean allInteger = true;
        boolean allNumeric = true;
        for (String cell : cells) {
            if (isMissing(cell)) {
                continue;
            }
            anyPresent = true;
            CellKind kind = classify(cell.trim());
            if (kind == CellKind.OTHER) {
                return ColumnType.TEXT;
            }
            allBoolean &= kind == CellKind.BOOLEAN;
            allInteger &= kind == CellKind.INTEGER;
            allNumeric &= kind == CellKind.INTEGER || kind == CellKind.DECIMAL;
        }
        if (!anyPresent) {
            return ColumnType.TEXT;
        }
        if (allBoolean) {
            return ColumnType.BOOLEAN;
        }
        if (allInteger) {
            return ColumnType.INT64;
        }
        return allNumeric ? ColumnType.FLOAT64 : ColumnType.TEXT;
    }

    private static CellKind classify(String cell) {
        if ("true".equalsIgnoreCase(cell) || "false".equalsIgnoreCase(cell)) {
            return CellKind.BOOLEAN;
        }
        if (INTEGER.matcher(cell).matches()) {
            try {
                Long.parseLong(cell);
                return CellKind.INTEGER;
            } catch (NumberFormatException e) {
                // Beyond 64 bits: keep the digits as text
                return CellKind.OTHER;
            }
        }
        if (DECIMAL.matcher(cell).matches()) {
            return CellKind.DECIMAL;
        }
        return CellKind.OTHER;
    }
}
