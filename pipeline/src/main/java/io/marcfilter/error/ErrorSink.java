package io.marcfilter.error;

/**
 * Receives record-scoped failures as they happen.
 */
public interface ErrorSink extends AutoCloseable {
    ErrorSink NOOP = error -> {};

    void accept(RecordError error);

    @Override
    default void close() {}
}
