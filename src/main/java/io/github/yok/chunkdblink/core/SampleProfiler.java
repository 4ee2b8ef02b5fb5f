package io.github.yok.chunkdblink.core;

import com.google.common.base.Preconditions;
import io.github.yok.chunkdblink.config.IngestConfig;
import io.github.yok.chunkdblink.dataset.Chunk;
import io.github.yok.chunkdblink.dataset.ChunkColumn;
import io.github.yok.chunkdblink.parser.CsvChunkReader;
import io.github.yok.chunkdblink.parser.LineCounter;
import io.github.yok.chunkdblink.util.LogPathUtil;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Profiles a dataset file from a bounded leading sample without loading the whole file.
 *
 * <p>
 * The sample is read with the same per-chunk type inference as a load, but without narrowing, so
 * the reported types are the parsed ones. Row count is taken from a full line-count pass; memory
 * usage is extrapolated linearly from the sample. Profiling never writes to the store.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SampleProfiler {

    // CSV format, NA tokens, default sample size and preview length
    private final IngestConfig ingestConfig;

    /**
     * Profiles {@code path} with the configured sample size.
     *
     * @param path dataset file
     * @return profile
     * @see #analyzeSample(Path, int)
     */
    public SampleProfile analyzeSample(Path path) {
        return analyzeSample(path, ingestConfig.getSampleSize());
    }

    /**
     * Profiles {@code path} from at most {@code sampleSize} leading data rows.
     *
     * @param path dataset file
     * @param sampleSize maximum data rows to read, positive
     * @return profile with per-column statistics and dataset-wide estimates
     * @throws io.github.yok.chunkdblink.exception.DatasetReadException if the file cannot be read
     * @throws io.github.yok.chunkdblink.exception.DatasetFormatException if a sampled row is
     *         malformed
     */
    public SampleProfile analyzeSample(Path path, int sampleSize) {
        Preconditions.checkArgument(sampleSize > 0, "sampleSize must be positive: %s", sampleSize);
        log.info("Analyzing sample of {} rows from {}", sampleSize,
                LogPathUtil.renderPathForLog(path));

        Chunk sample = CsvChunkReader.readLeading(path, sampleSize, ingestConfig);

        List<ColumnProfile> columns = new ArrayList<>(sample.getColumns().size());
        for (ChunkColumn column : sample.getColumns()) {
            columns.add(new ColumnProfile(column.getName(), column.getType(),
                    column.countMissing(), column.estimateMemoryBytes()));
        }

        int previewRows = Math.min(ingestConfig.getPreviewRows(), sample.getRowCount());
        List<Map<String, Object>> preview = new ArrayList<>(previewRows);
        for (int i = 0; i < previewRows; i++) {
            preview.add(sample.getRow(i));
        }

        long totalLines = LineCounter.count(path, ingestConfig.getCharset());
        long estimatedTotalRows = Math.max(0, totalLines - 1);

        SampleProfile profile =
                new SampleProfile(sample.getRowCount(), estimatedTotalRows, columns, preview);
        log.info("Sample analysis complete: sampled={}, estimatedTotalRows={}, "
                + "estimatedMemoryUsage={} MB", profile.getSampleSize(),
                profile.getEstimatedTotalRows(),
                String.format("%.2f", profile.getEstimatedMemoryUsage()));
        return profile;
    }
}
