package io.github.yok.chunkdblink.parser;

import io.github.yok.chunkdblink.exception.DatasetReadException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;

/**
 * Counts the physical lines of a text file in one streaming pass.
 *
 * <p>
 * The count includes the header line. Only the current line is held in memory.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class LineCounter {

    /**
     * Prevents instantiation.
     */
    @Generated
    private LineCounter() {}

    /**
     * Counts the lines of {@code path}.
     *
     * @param path file to scan
     * @param charset file encoding
     * @return number of lines, {@code 0} for an empty file
     * @throws DatasetReadException if the file cannot be opened or read
     */
    public static long count(Path path, Charset charset) {
        long lines = 0;
        try (LineIterator it = FileUtils.lineIterator(path.toFile(), charset.name())) {
            while (it.hasNext()) {
                it.next();
                lines++;
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            // LineIterator reports read failures during iteration as IllegalStateException
            log.error("Failed to count lines of {}: {}", path, e.getMessage(), e);
            throw new DatasetReadException("Failed to read dataset file: " + path, e);
        }
        log.debug("Counted {} lines in {}", lines, path);
        return lines;
    }
}
