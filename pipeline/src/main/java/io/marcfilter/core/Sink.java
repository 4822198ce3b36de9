package io.marcfilter.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sink consumes records in the order they are handed over.
 */
public interface Sink<T> extends Closeable {
    /**
     * @throws io.marcfilter.error.RecordException when this one record cannot be written;
     *         nothing of it has reached the underlying stream
     * @throws IOException when the underlying stream fails
     */
    void accept(Record<T> record) throws IOException;

    default void flush() throws IOException {}

    @Override
    default void close() throws IOException {}
}
