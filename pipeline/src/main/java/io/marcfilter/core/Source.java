package io.marcfilter.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A Source produces records one at a time, in input order.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record. Returns empty once the input is exhausted, after which
     * {@link #isFinished()} is true.
     *
     * @throws io.marcfilter.error.RecordException when the next record is malformed but the
     *         source has already positioned itself at the following record
     * @throws io.marcfilter.error.StreamFatalException when the source cannot continue
     */
    Optional<Record<T>> poll();

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() throws IOException {}
}
