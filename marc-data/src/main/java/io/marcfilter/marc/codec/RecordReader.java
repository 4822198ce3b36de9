package io.marcfilter.marc.codec;

import io.marcfilter.marc.model.MarcRecord;

import java.io.Closeable;
import java.util.Optional;

/**
 * Pulls records one at a time from an input stream.
 */
public interface RecordReader extends Closeable {
    /**
     * @return the next record, or empty at a clean end of stream
     * @throws MarcDecodeException the next record is malformed; the reader is positioned after it
     * @throws io.marcfilter.error.StreamFatalException the reader cannot find the next record
     */
    Optional<MarcRecord> next();

    /** Records consumed so far, malformed ones included. */
    long recordsRead();

    /** Byte offset at which the most recently returned or rejected record started. */
    long lastRecordOffset();
}
