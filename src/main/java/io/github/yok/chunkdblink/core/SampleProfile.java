package io.github.yok.chunkdblink.core;

import io.github.yok.chunkdblink.dataset.ColumnType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of {@link SampleProfiler#analyzeSample}: column statistics measured on a leading sample
 * and dataset-wide estimates extrapolated from it.
 *
 * <p>
 * All mappings are ordered by the file's column order. Values are plain data for presentation;
 * nothing here is persisted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public class SampleProfile {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    // Data rows actually read into the sample
    private final int sampleSize;

    // Full-file line count minus the header line
    private final long estimatedTotalRows;

    private final List<ColumnProfile> columns;

    // First rows of the sample as name-to-value mappings
    private final List<Map<String, Object>> samplePreview;

    /**
     * Creates a profile.
     *
     * @param sampleSize data rows read into the sample
     * @param estimatedTotalRows line count minus one
     * @param columns per-column statistics in file order
     * @param samplePreview leading rows of the sample
     */
    public SampleProfile(int sampleSize, long estimatedTotalRows, List<ColumnProfile> columns,
            List<Map<String, Object>> samplePreview) {
        this.sampleSize = sampleSize;
        this.estimatedTotalRows = estimatedTotalRows;
        this.columns = List.copyOf(columns);
        this.samplePreview = Collections.unmodifiableList(samplePreview);
    }

    /**
     * Returns the factor applied to the sample footprint to estimate the whole file.
     *
     * @return {@code estimatedTotalRows / sampleSize}, or {@code 0} for an empty sample
     */
    public double getExtrapolationFactor() {
        return sampleSize == 0 ? 0.0 : (double) estimatedTotalRows / sampleSize;
    }

    /**
     * Returns the estimated memory needed to hold the whole file, in megabytes.
     *
     * @return sum of per-column sample bytes, in MB, times the extrapolation factor
     */
    public double getEstimatedMemoryUsage() {
        long sampleBytes = columns.stream().mapToLong(ColumnProfile::getMemoryBytes).sum();
        return sampleBytes / BYTES_PER_MB * getExtrapolationFactor();
    }

    /**
     * Returns the inferred type of each column.
     *
     * @return ordered mapping of column name to type
     */
    public Map<String, ColumnType> getColumnTypes() {
        return toMap(ColumnProfile::getType);
    }

    /**
     * Returns the missing-value count of each column.
     *
     * @return ordered mapping of column name to count
     */
    public Map<String, Long> getMissingValues() {
        return toMap(ColumnProfile::getMissingCount);
    }

    /**
     * Returns the sample footprint of each column.
     *
     * @return ordered mapping of column name to bytes
     */
    public Map<String, Long> getMemoryUsage() {
        return toMap(ColumnProfile::getMemoryBytes);
    }

    private <T> Map<String, T> toMap(Function<ColumnProfile, T> getter) {
        Map<String, T> map = new LinkedHashMap<>();
        columns.forEach(c -> map.put(c.getName(), getter.apply(c)));
        return Collections.unmodifiableMap(map);
    }
}
