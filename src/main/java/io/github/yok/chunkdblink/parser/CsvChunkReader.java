package io.github.yok.chunkdblink.parser;

import com.google.common.base.Preconditions;
import io.github.yok.chunkdblink.config.IngestConfig;
import io.github.yok.chunkdblink.dataset.Chunk;
import io.github.yok.chunkdblink.dataset.ChunkColumn;
import io.github.yok.chunkdblink.dataset.ColumnTypeInference;
import io.github.yok.chunkdblink.exception.DatasetFormatException;
import io.github.yok.chunkdblink.exception.DatasetReadException;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Streams a delimited text file as a lazy, finite, non-restartable sequence of {@link Chunk}s.
 *
 * <p>
 * Every chunk holds exactly {@code chunkSize} data rows except possibly the last, which holds the
 * remainder. Column order and header-to-value mapping follow the file's header row. Column types
 * are inferred per chunk from that chunk's cells only.
 * </p>
 *
 * <p>
 * {@link #open(Path, int, IngestConfig, ProgressListener)} scans the whole file once to count its
 * lines before the first chunk is read; that count drives the progress notifications. Only the
 * chunk being assembled is held in memory. The underlying file is closed once the last chunk has
 * been returned, or by {@link #close()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvChunkReader implements Iterator<Chunk>, Closeable {

    private final Path path;

    private final int chunkSize;

    private final ColumnTypeInference inference;

    private final ProgressListener listener;

    private final CSVParser parser;

    private final Iterator<CSVRecord> records;

    @Getter
    private final List<String> header;

    // Chunk count derived from the line-count pre-pass (0 when not computed)
    @Getter
    private final long expectedChunks;

    @Getter
    private long rowsRead;

    @Getter
    private int chunksRead;

    private boolean closed;

    private CsvChunkReader(Path path, int chunkSize, ColumnTypeInference inference,
            ProgressListener listener, CSVParser parser, long expectedChunks) {
        this.path = path;
        this.chunkSize = chunkSize;
        this.inference = inference;
        this.listener = listener;
        this.parser = parser;
        this.records = parser.iterator();
        this.header = List.copyOf(parser.getHeaderNames());
        this.expectedChunks = expectedChunks;
        if (header.isEmpty()) {
            close();
            String msg = "No header row in " + path;
            log.error(msg);
            throw new DatasetFormatException(msg);
        }
    }

    /**
     * Opens a reader over {@code path} after counting its lines.
     *
     * @param path dataset file
     * @param chunkSize maximum data rows per chunk, positive
     * @param config CSV format and NA settings
     * @param listener receives a notification after each chunk
     * @return reader positioned before the first chunk
     * @throws IllegalArgumentException if {@code chunkSize} is not positive
     * @throws DatasetReadException if the file cannot be opened or read
     */
    public static CsvChunkReader open(Path path, int chunkSize, IngestConfig config,
            ProgressListener listener) {
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive: %s", chunkSize);
        Preconditions.checkNotNull(listener, "listener must not be null");

        long lines = LineCounter.count(path, config.getCharset());
        long dataRows = Math.max(0, lines - 1);
        long expectedChunks = (dataRows + chunkSize - 1) / chunkSize;
        log.info("Processing {} in chunks of {} rows ({} lines, ~{} chunks)", path, chunkSize,
                lines, expectedChunks);

        return new CsvChunkReader(path, chunkSize, inferenceOf(config), listener,
                openParser(path, config), expectedChunks);
    }

    /**
     * Reads at most {@code limit} leading data rows as a single chunk, without the line-count
     * pre-pass.
     *
     * @param path dataset file
     * @param limit maximum data rows to read, positive
     * @param config CSV format and NA settings
     * @return chunk of {@code min(limit, data rows)} rows; zero rows for a header-only file
     * @throws DatasetReadException if the file cannot be opened or read
     * @throws DatasetFormatException if a row's column count differs from the header's
     */
    public static Chunk readLeading(Path path, int limit, IngestConfig config) {
        Preconditions.checkArgument(limit > 0, "limit must be positive: %s", limit);
        try (CsvChunkReader reader = new CsvChunkReader(path, limit, inferenceOf(config),
                ProgressListener.NONE, openParser(path, config), 0)) {
            if (!reader.hasNext()) {
                return reader.assemble(new ArrayList<>());
            }
            return reader.next();
        }
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        try {
            boolean more = records.hasNext();
            if (!more) {
                close();
            }
            return more;
        } catch (UncheckedIOException | IllegalStateException e) {
            throw translate(e);
        }
    }

    @Override
    public Chunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more chunks in " + path);
        }
        List<String[]> rows = new ArrayList<>(Math.min(chunkSize, 1024));
        try {
            while (rows.size() < chunkSize && records.hasNext()) {
                CSVRecord record = records.next();
                if (record.size() != header.size()) {
                    close();
                    String msg = String.format(
                            "Malformed row in %s: data row %d has %d columns, expected %d columns",
                            path, rowsRead + rows.size() + 1, record.size(), header.size());
                    log.error(msg);
                    throw new DatasetFormatException(msg);
                }
                rows.add(record.values());
            }
        } catch (UncheckedIOException | IllegalStateException e) {
            throw translate(e);
        }

        Chunk chunk = assemble(rows);
        rowsRead += rows.size();
        chunksRead++;
        listener.onChunkRead(chunksRead, expectedChunks, rowsRead);
        if (rows.size() < chunkSize) {
            // The record iterator ran dry inside this chunk
            close();
        }
        return chunk;
    }

    /**
     * Closes the underlying file. Further calls to {@link #hasNext()} return {@code false}.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            parser.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", path, e.getMessage(), e);
        }
    }

    /**
     * Converts row-wise cells into typed columns.
     *
     * @param rows raw rows, each of header length
     * @return chunk starting at the current row offset
     */
    private Chunk assemble(List<String[]> rows) {
        List<ChunkColumn> columns = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            String[] cells = new String[rows.size()];
            for (int r = 0; r < rows.size(); r++) {
                cells[r] = rows.get(r)[c];
            }
            columns.add(inference.build(header.get(c), cells));
        }
        return new Chunk(rowsRead, rows.size(), columns);
    }

    private RuntimeException translate(RuntimeException e) {
        close();
        Throwable cause = e.getCause();
        if (cause instanceof CSVException) {
            String msg = "Malformed CSV content in " + path + ": " + cause.getMessage();
            log.error(msg, e);
            return new DatasetFormatException(msg, cause);
        }
        log.error("Failed to read {}: {}", path, e.getMessage(), e);
        return new DatasetReadException("Failed to read dataset file: " + path,
                cause != null ? cause : e);
    }

    private static ColumnTypeInference inferenceOf(IngestConfig config) {
        return new ColumnTypeInference(config.getNaValues());
    }

    /**
     * Builds the CSV format: first record is the header, empty lines are skipped.
     *
     * @param config delimiter settings
     * @return CSV format
     */
    static CSVFormat buildFormat(IngestConfig config) {
        return CSVFormat.DEFAULT.builder().setDelimiter(config.getDelimiter()).setHeader()
                .setSkipHeaderRecord(true).setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true).get();
    }

    private static CSVParser openParser(Path path, IngestConfig config) {
        Reader reader = null;
        try {
            reader = Files.newBufferedReader(path, config.getCharset());
            return buildFormat(config).parse(reader);
        } catch (IOException | UncheckedIOException e) {
            if (reader != null) {
                try {
                    reader.close();
                } catch (IOException closeEx) {
                    e.addSuppressed(closeEx);
                }
            }
            log.error("Failed to open {}: {}", path, e.getMessage(), e);
            throw new DatasetReadException("Failed to open dataset file: " + path, e);
        }
    }
}
