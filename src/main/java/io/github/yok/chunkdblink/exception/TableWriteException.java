package io.github.yok.chunkdblink.exception;

/**
 * Thrown when writing a chunk to the relational store fails.
 *
 * <p>
 * Chunks committed before the failing one remain in the table; the table is left partially
 * loaded and a new load (which replaces the table) is required.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TableWriteException extends ChunkDbLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause store-level failure
     */
    public TableWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
