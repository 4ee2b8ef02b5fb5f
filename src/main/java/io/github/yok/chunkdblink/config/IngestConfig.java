package io.github.yok.chunkdblink.config;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code ingest} section in {@code application.yml}.
 *
 * <pre>
 * ingest:
 *   chunk-size: 10000
 *   sample-size: 10000
 *   encoding: UTF-8
 *   delimiter: ","
 *   categorical-ratio: 0.5
 *   preview-rows: 5
 *   widen-table-columns: true
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "ingest")
@Data
public class IngestConfig {

    /**
     * Number of data rows per chunk when a load does not specify one.
     */
    private int chunkSize = 10000;

    /**
     * Number of leading data rows read by the sample profiler.
     */
    private int sampleSize = 10000;

    /**
     * Character encoding of the dataset files.
     */
    private String encoding = "UTF-8";

    /**
     * Field delimiter of the dataset files.
     */
    private char delimiter = ',';

    /**
     * Cell values treated as missing in addition to the empty string.
     */
    private List<String> naValues = new ArrayList<>(Arrays.asList("NA", "N/A", "n/a", "NaN",
            "nan", "-NaN", "-nan", "null", "NULL", "None", "#N/A", "<NA>"));

    /**
     * Text columns whose distinct-value ratio is below this value are stored as categories.
     */
    private double categoricalRatio = 0.5;

    /**
     * Number of rows kept as preview in a sample profile.
     */
    private int previewRows = 5;

    /**
     * When {@code true}, integer columns are created as {@code BIGINT} and categorical columns as
     * text, so that later chunks narrowed to a wider type still fit. When {@code false}, the SQL
     * column types follow the first chunk's narrowed widths exactly.
     */
    private boolean widenTableColumns = true;

    /**
     * Returns the configured encoding as a {@link Charset}.
     *
     * @return charset
     * @throws java.nio.charset.UnsupportedCharsetException if the name is unknown
     */
    public Charset getCharset() {
        return Charset.forName(encoding);
    }
}
