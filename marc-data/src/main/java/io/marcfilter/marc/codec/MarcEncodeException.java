package io.marcfilter.marc.codec;

import io.marcfilter.error.RecordException;

/**
 * A record cannot be represented in a target format, e.g. it outgrows the binary
 * format's length fields. Nothing of the record has been written.
 */
public class MarcEncodeException extends RecordException {
    public MarcEncodeException(String message) {
        super(message, -1, -1);
    }

    public MarcEncodeException(String message, Throwable cause) {
        super(message, -1, -1, cause);
    }
}
