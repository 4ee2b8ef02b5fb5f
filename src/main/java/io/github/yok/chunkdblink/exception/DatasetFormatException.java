package io.github.yok.chunkdblink.exception;

/**
 * Thrown when a data row's column count does not match the header row.
 *
 * @author Yasuharu.Okawauchi
 */
public class DatasetFormatException extends ChunkDbLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message including the offending record number
     */
    public DatasetFormatException(String message) {
        super(message);
    }

    /**
     * Creates the exception with the parser failure that revealed the malformed row.
     *
     * @param message detail message
     * @param cause parser failure
     */
    public DatasetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
