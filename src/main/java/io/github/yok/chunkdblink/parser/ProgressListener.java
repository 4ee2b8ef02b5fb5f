package io.github.yok.chunkdblink.parser;

/**
 * Receives progress notifications from a {@link CsvChunkReader}.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * Listener that ignores every notification.
     */
    ProgressListener NONE = (chunksRead, expectedChunks, rowsRead) -> {
    };

    /**
     * Called after each chunk has been read.
     *
     * @param chunksRead chunks read so far, including this one
     * @param expectedChunks chunk count derived from the upfront line count
     * @param rowsRead data rows read so far
     */
    void onChunkRead(int chunksRead, long expectedChunks, long rowsRead);
}
