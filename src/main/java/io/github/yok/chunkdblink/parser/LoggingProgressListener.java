package io.github.yok.chunkdblink.parser;

import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ProgressListener} that logs each chunk at INFO level.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingProgressListener implements ProgressListener {

    // File being read, for log context
    private final Path path;

    @Override
    public void onChunkRead(int chunksRead, long expectedChunks, long rowsRead) {
        long percent = expectedChunks <= 0 ? 100 : Math.min(100, chunksRead * 100L / expectedChunks);
        log.info("Reading CSV [{}]: chunk {}/{} ({}%), rows={}", path.getFileName(), chunksRead,
                expectedChunks, percent, rowsRead);
    }
}
