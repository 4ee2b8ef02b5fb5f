package io.github.yok.chunkdblink.exception;

/**
 * Thrown when a dataset file cannot be opened or read.
 *
 * @author Yasuharu.Okawauchi
 */
public class DatasetReadException extends ChunkDbLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception without an underlying cause.
     *
     * @param message detail message
     */
    public DatasetReadException(String message) {
        super(message);
    }

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause underlying I/O failure
     */
    public DatasetReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
