package io.marcfilter.marc.codec;

import io.marcfilter.error.RecordException;

/**
 * A record could not be decoded: malformed leader, length inconsistent with content,
 * missing terminator or a broken directory. The reader has already consumed the record's
 * declared byte span, so reading can continue with the next record.
 */
public class MarcDecodeException extends RecordException {
    public MarcDecodeException(String message, long recordIndex, long byteOffset) {
        super(message, recordIndex, byteOffset);
    }

    public MarcDecodeException(String message, long recordIndex, long byteOffset, Throwable cause) {
        super(message, recordIndex, byteOffset, cause);
    }
}
