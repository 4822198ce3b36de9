package io.marcfilter.error;

/**
 * A failure confined to a single record. The pipeline counts it, reports it and moves on
 * to the next record.
 */
public class RecordException extends RuntimeException {
    private final long recordIndex;
    private final long byteOffset;

    public RecordException(String message, long recordIndex, long byteOffset) {
        super(message);
        this.recordIndex = recordIndex;
        this.byteOffset = byteOffset;
    }

    public RecordException(String message, long recordIndex, long byteOffset, Throwable cause) {
        super(message, cause);
        this.recordIndex = recordIndex;
        this.byteOffset = byteOffset;
    }

    /** Zero-based index of the failing record, -1 when the thrower does not know it. */
    public long recordIndex() { return recordIndex; }

    /** Byte offset of the failing record in its input, -1 when not applicable. */
    public long byteOffset() { return byteOffset; }
}
