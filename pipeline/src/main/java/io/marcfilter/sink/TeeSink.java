package io.marcfilter.sink;

import io.marcfilter.core.Record;
import io.marcfilter.core.Sink;

import java.io.IOException;
import java.util.List;

/**
 * Hands each record to several sinks in order, e.g. one per output representation.
 * <p>
 * Sinks that implement {@link Prepared} get to encode the record first, so a record that one
 * target cannot represent is rejected before any target has written it.
 */
public class TeeSink<T> implements Sink<T> {
    /**
     * A sink that can split encoding from writing.
     */
    public interface Prepared<T> extends Sink<T> {
        /** Encodes the record; throws {@link io.marcfilter.error.RecordException} if it cannot. */
        byte[] prepare(Record<T> record);

        /** Writes bytes produced by {@link #prepare}. */
        void write(byte[] encoded) throws IOException;

        @Override
        default void accept(Record<T> record) throws IOException {
            write(prepare(record));
        }
    }

    private final List<Sink<T>> sinks;

    public TeeSink(List<? extends Sink<T>> sinks) {
        if (sinks.isEmpty()) throw new IllegalArgumentException("TeeSink needs at least one sink");
        this.sinks = List.copyOf(sinks);
    }

    public List<Sink<T>> sinks() { return sinks; }

    @Override
    public void accept(Record<T> record) throws IOException {
        byte[][] prepared = new byte[sinks.size()][];
        for (int i = 0; i < sinks.size(); i++) {
            if (sinks.get(i) instanceof Prepared<T> p) prepared[i] = p.prepare(record);
        }
        for (int i = 0; i < sinks.size(); i++) {
            Sink<T> s = sinks.get(i);
            if (s instanceof Prepared<T> p) {
                p.write(prepared[i]);
            } else {
                s.accept(record);
            }
        }
    }

    @Override
    public void flush() throws IOException {
        for (Sink<T> s : sinks) s.flush();
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (Sink<T> s : sinks) {
            try {
                s.close();
            } catch (IOException e) {
                if (failure == null) failure = e; else failure.addSuppressed(e);
            }
        }
        if (failure != null) throw failure;
    }
}
