package io.github.yok.chunkdblink.exception;

/**
 * Base class of the failures raised by the ingestion, loading and query operations.
 *
 * <p>
 * Unchecked, because chunks and result pages are produced through {@link java.util.Iterator}
 * which cannot declare checked exceptions. Every subclass is logged at the point of detection and
 * then propagated unchanged to the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public abstract class ChunkDbLinkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message and root cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    protected ChunkDbLinkException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception with a message only.
     *
     * @param message detail message
     */
    protected ChunkDbLinkException(String message) {
        super(message);
    }
}
