package io.marcfilter.error;

/**
 * The input or output stream cannot be used any further: an I/O failure, or a reader that
 * lost track of where the next record starts. Output written so far stays in place.
 */
public class StreamFatalException extends RuntimeException {
    private final long byteOffset;

    public StreamFatalException(String message, long byteOffset) {
        super(message);
        this.byteOffset = byteOffset;
    }

    public StreamFatalException(String message, long byteOffset, Throwable cause) {
        super(message, cause);
        this.byteOffset = byteOffset;
    }

    public long byteOffset() { return byteOffset; }
}
