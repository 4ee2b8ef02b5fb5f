package io.github.yok.chunkdblink.exception;

/**
 * Thrown when a query is malformed or the store fails while executing or fetching it.
 *
 * @author Yasuharu.Okawauchi
 */
public class QueryExecutionException extends ChunkDbLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause store-level failure
     */
    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
